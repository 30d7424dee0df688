package org.example.ticketservice.usecase;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.PriorityChange;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.TicketPriority;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.event.TicketPriorityChangedEvent;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Lets an administrator set or change a ticket's priority.
 */
@Slf4j
@Service
public class ChangeTicketPriorityUseCase {

    private final TicketRepository ticketRepository;
    private final EventPublication publication;

    public ChangeTicketPriorityUseCase(TicketRepository ticketRepository, TicketEventPublisher eventPublisher) {
        this.ticketRepository = ticketRepository;
        this.publication = new EventPublication(eventPublisher);
    }

    public UseCaseResult<Ticket> execute(ChangeTicketPriorityCommand command) {
        if (command == null || command.getTicketId() == null) {
            throw new InvalidTicketDataException("ticket_id", "Ticket ID is required");
        }

        Ticket ticket = ticketRepository.findById(command.getTicketId());
        Optional<PriorityChange> change = ticket.changePriority(
                TicketPriority.fromValue(command.getNewPriority()),
                command.getJustification(),
                command.getRequesterRole());

        if (change.isEmpty()) {
            log.debug("Priority of ticket {} already {} - nothing to do",
                    ticket.getId(), ticket.getPriority().getLabel());
            return UseCaseResult.unchanged(ticket);
        }

        Ticket saved = ticketRepository.save(ticket);
        log.info("✅ Ticket priority changed - id: {}, {} -> {}",
                saved.getId(), change.get().getOldPriority().getLabel(), change.get().getNewPriority().getLabel());

        return publication.publishAfterPersist(saved, TicketPriorityChangedEvent.from(saved.getId(), change.get()));
    }
}
