package org.example.ticketservice.usecase;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.event.TicketDeletedEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

/**
 * Physically removes a ticket together with its responses.
 */
@Slf4j
@Service
public class DeleteTicketUseCase {

    private final TicketRepository ticketRepository;
    private final EventPublication publication;

    public DeleteTicketUseCase(TicketRepository ticketRepository, TicketEventPublisher eventPublisher) {
        this.ticketRepository = ticketRepository;
        this.publication = new EventPublication(eventPublisher);
    }

    /**
     * @return the id of the deleted ticket
     */
    public UseCaseResult<Long> execute(DeleteTicketCommand command) {
        if (command == null || command.getTicketId() == null) {
            throw new InvalidTicketDataException("ticket_id", "Ticket ID is required");
        }
        Long ticketId = command.getTicketId();

        ticketRepository.findById(ticketId);
        ticketRepository.delete(ticketId);

        log.info("✅ Ticket deleted - id: {}", ticketId);

        return publication.publishAfterPersist(ticketId, new TicketDeletedEvent(ticketId));
    }
}
