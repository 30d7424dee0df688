package org.example.ticketservice.repository;

import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.TicketStatus;
import org.example.ticketservice.exception.TicketNotFoundException;

import java.util.List;

/**
 * Persistence boundary for the ticket aggregate.
 *
 * <p>Saves are last-write-wins; no version check is made against concurrent writers.</p>
 */
public interface TicketRepository {

    /**
     * Persists the aggregate including its responses.
     *
     * @return the stored ticket, with ids assigned to it and to any new response
     */
    Ticket save(Ticket ticket);

    /**
     * @throws TicketNotFoundException if no ticket has this id
     */
    Ticket findById(Long id);

    /**
     * Physically removes the ticket and its responses.
     *
     * @throws TicketNotFoundException if no ticket has this id
     */
    void delete(Long id);

    /**
     * All tickets, newest first.
     */
    List<Ticket> findAll();

    List<Ticket> findByStatus(TicketStatus status);

    List<Ticket> findByUserId(String userId);
}
