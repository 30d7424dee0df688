package org.example.ticketservice.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.TicketStatus;
import org.example.ticketservice.entity.TicketEntity;
import org.example.ticketservice.exception.TicketNotFoundException;
import org.example.ticketservice.mapper.TicketMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * {@link TicketRepository} backed by Spring Data JPA.
 */
@Slf4j
@Component
@Transactional
@RequiredArgsConstructor
public class JpaTicketRepository implements TicketRepository {

    private final TicketJpaRepository jpaRepository;
    private final TicketMapper ticketMapper;

    @Override
    public Ticket save(Ticket ticket) {
        TicketEntity entity;
        if (ticket.isNew()) {
            entity = ticketMapper.toNewEntity(ticket);
        } else {
            entity = jpaRepository.findById(ticket.getId())
                    .orElseThrow(() -> new TicketNotFoundException(ticket.getId()));
            ticketMapper.updateEntity(entity, ticket);
        }

        TicketEntity saved = jpaRepository.saveAndFlush(entity);
        log.debug("💾 Saved ticket - id: {}, status: {}, responses: {}",
                saved.getId(), saved.getStatus(), saved.getResponses().size());
        return ticketMapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Ticket findById(Long id) {
        return jpaRepository.findById(id)
                .map(ticketMapper::toDomain)
                .orElseThrow(() -> new TicketNotFoundException(id));
    }

    @Override
    public void delete(Long id) {
        TicketEntity entity = jpaRepository.findById(id)
                .orElseThrow(() -> new TicketNotFoundException(id));
        jpaRepository.delete(entity);
        jpaRepository.flush();
        log.debug("🗑️ Deleted ticket - id: {}", id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Ticket> findAll() {
        return toDomain(jpaRepository.findAllByOrderByCreatedAtDescIdDesc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Ticket> findByStatus(TicketStatus status) {
        return toDomain(jpaRepository.findByStatusOrderByCreatedAtDescIdDesc(status));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Ticket> findByUserId(String userId) {
        return toDomain(jpaRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId));
    }

    private List<Ticket> toDomain(List<TicketEntity> entities) {
        return entities.stream()
                .map(ticketMapper::toDomain)
                .toList();
    }
}
