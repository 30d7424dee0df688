package org.example.ticketservice.usecase;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.StatusChange;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.event.TicketStatusChangedEvent;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Moves a ticket along OPEN → IN_PROGRESS → CLOSED.
 * Asking for the current status succeeds without storing or publishing anything.
 */
@Slf4j
@Service
public class ChangeTicketStatusUseCase {

    private final TicketRepository ticketRepository;
    private final EventPublication publication;

    public ChangeTicketStatusUseCase(TicketRepository ticketRepository, TicketEventPublisher eventPublisher) {
        this.ticketRepository = ticketRepository;
        this.publication = new EventPublication(eventPublisher);
    }

    public UseCaseResult<Ticket> execute(ChangeTicketStatusCommand command) {
        if (command == null || command.getTicketId() == null) {
            throw new InvalidTicketDataException("ticket_id", "Ticket ID is required");
        }

        Ticket ticket = ticketRepository.findById(command.getTicketId());
        Optional<StatusChange> change = ticket.changeStatus(command.getNewStatus());

        if (change.isEmpty()) {
            log.debug("Status of ticket {} already {} - nothing to do", ticket.getId(), ticket.getStatus());
            return UseCaseResult.unchanged(ticket);
        }

        Ticket saved = ticketRepository.save(ticket);
        log.info("✅ Ticket status changed - id: {}, {} -> {}",
                saved.getId(), change.get().getOldStatus(), change.get().getNewStatus());

        return publication.publishAfterPersist(saved, TicketStatusChangedEvent.from(saved.getId(), change.get()));
    }
}
