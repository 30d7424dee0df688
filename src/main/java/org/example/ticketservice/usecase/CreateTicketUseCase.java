package org.example.ticketservice.usecase;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.event.TicketCreatedEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

/**
 * Opens a new ticket.
 *
 * <p>The ticket always starts OPEN and UNASSIGNED whatever the caller asks for.
 * Nothing is stored when validation fails.</p>
 */
@Slf4j
@Service
public class CreateTicketUseCase {

    private final TicketRepository ticketRepository;
    private final EventPublication publication;

    public CreateTicketUseCase(TicketRepository ticketRepository, TicketEventPublisher eventPublisher) {
        this.ticketRepository = ticketRepository;
        this.publication = new EventPublication(eventPublisher);
    }

    public UseCaseResult<Ticket> execute(CreateTicketCommand command) {
        if (command == null) {
            throw new InvalidTicketDataException("command", "Create ticket request cannot be null");
        }

        Ticket ticket = Ticket.create(command.getTitle(), command.getDescription(), command.getUserId());
        Ticket saved = ticketRepository.save(ticket);

        log.info("✅ Ticket created - id: {}, userId: {}", saved.getId(), saved.getUserId());

        return publication.publishAfterPersist(saved, TicketCreatedEvent.from(saved));
    }
}
