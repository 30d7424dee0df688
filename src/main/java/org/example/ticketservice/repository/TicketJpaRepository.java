package org.example.ticketservice.repository;

import org.example.ticketservice.domain.TicketStatus;
import org.example.ticketservice.entity.TicketEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data repository for {@link TicketEntity}.
 */
@Repository
public interface TicketJpaRepository extends JpaRepository<TicketEntity, Long> {

    List<TicketEntity> findAllByOrderByCreatedAtDescIdDesc();

    List<TicketEntity> findByStatusOrderByCreatedAtDescIdDesc(TicketStatus status);

    List<TicketEntity> findByUserIdOrderByCreatedAtDescIdDesc(String userId);
}
