package org.example.ticketservice.repository;

import org.example.ticketservice.domain.AdminResponse;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.TicketPriority;
import org.example.ticketservice.domain.TicketStatus;
import org.example.ticketservice.domain.UserRole;
import org.example.ticketservice.exception.TicketNotFoundException;
import org.example.ticketservice.mapper.TicketMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import({JpaTicketRepository.class, TicketMapper.class})
@DisplayName("JpaTicketRepository Tests")
class JpaTicketRepositoryTest {

    @Autowired
    private TicketRepository ticketRepository;

    private Ticket saveNew(String title, String userId) {
        return ticketRepository.save(Ticket.create(title, "description of " + title, userId));
    }

    @Test
    @DisplayName("Should assign ids and reload a created ticket unchanged")
    void shouldRoundTripCreatedTicket() {
        Ticket saved = saveNew("T1", "user-1");

        Ticket reloaded = ticketRepository.findById(saved.getId());

        assertThat(saved.getId()).isNotNull();
        assertThat(reloaded.getCreatedAt()).isNotNull();
        assertThat(reloaded.getTitle()).isEqualTo("T1");
        assertThat(reloaded.getDescription()).isEqualTo("description of T1");
        assertThat(reloaded.getStatus()).isEqualTo(TicketStatus.OPEN);
        assertThat(reloaded.getPriority()).isEqualTo(TicketPriority.UNASSIGNED);
        assertThat(reloaded.getResponses()).isEmpty();
    }

    @Test
    @DisplayName("Should persist status, priority and appended responses")
    void shouldPersistChanges() {
        Ticket ticket = saveNew("Printer broken", "user-1");

        ticket.changeStatus(TicketStatus.IN_PROGRESS);
        ticket.changePriority(TicketPriority.HIGH, "whole floor affected", UserRole.ADMIN);
        ticket.addResponse("Technician on the way", "admin-1");
        ticketRepository.save(ticket);

        Ticket reloaded = ticketRepository.findById(ticket.getId());
        reloaded.addResponse("Fixed", "admin-2");
        Ticket saved = ticketRepository.save(reloaded);

        assertThat(saved.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(saved.getPriority()).isEqualTo(TicketPriority.HIGH);
        assertThat(saved.getPriorityJustification()).isEqualTo("whole floor affected");
        assertThat(saved.getResponses())
                .extracting(AdminResponse::getText)
                .containsExactly("Technician on the way", "Fixed");
        assertThat(saved.getResponses()).allSatisfy(r -> assertThat(r.getId()).isNotNull());
    }

    @Test
    @DisplayName("Should filter by status and owner")
    void shouldFilter() {
        Ticket first = saveNew("First", "user-1");
        saveNew("Second", "user-2");
        first.changeStatus(TicketStatus.IN_PROGRESS);
        ticketRepository.save(first);

        assertThat(ticketRepository.findByStatus(TicketStatus.IN_PROGRESS))
                .extracting(Ticket::getTitle)
                .containsExactly("First");
        assertThat(ticketRepository.findByUserId("user-2"))
                .extracting(Ticket::getTitle)
                .containsExactly("Second");
        assertThat(ticketRepository.findAll()).hasSize(2);
    }

    @Test
    @DisplayName("Should delete a ticket together with its responses")
    void shouldDelete() {
        Ticket ticket = saveNew("Printer broken", "user-1");
        ticket.addResponse("Looking", "admin-1");
        ticketRepository.save(ticket);

        ticketRepository.delete(ticket.getId());

        assertThatThrownBy(() -> ticketRepository.findById(ticket.getId()))
                .isInstanceOf(TicketNotFoundException.class);
    }

    @Test
    @DisplayName("Should report unknown ids")
    void shouldReportUnknownIds() {
        assertThatThrownBy(() -> ticketRepository.findById(12345L))
                .isInstanceOf(TicketNotFoundException.class);
        assertThatThrownBy(() -> ticketRepository.delete(12345L))
                .isInstanceOf(TicketNotFoundException.class);
    }
}
