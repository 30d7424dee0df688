package org.example.ticketservice.usecase;

import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.AdminResponse;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.UserRole;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.event.TicketResponseAddedEvent;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.exception.PermissionDeniedException;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Appends an administrator response to an open ticket.
 */
@Slf4j
@Service
public class AddTicketResponseUseCase {

    private final TicketRepository ticketRepository;
    private final EventPublication publication;

    public AddTicketResponseUseCase(TicketRepository ticketRepository, TicketEventPublisher eventPublisher) {
        this.ticketRepository = ticketRepository;
        this.publication = new EventPublication(eventPublisher);
    }

    /**
     * @return the stored response, carrying its assigned id
     */
    public UseCaseResult<AdminResponse> execute(AddTicketResponseCommand command) {
        if (command == null || command.getTicketId() == null) {
            throw new InvalidTicketDataException("ticket_id", "Ticket ID is required");
        }
        UserRole role = command.getRequesterRole();
        if (role == null || !role.canRespondToTickets()) {
            throw new PermissionDeniedException("respond to tickets", String.valueOf(role));
        }

        Ticket ticket = ticketRepository.findById(command.getTicketId());
        ticket.addResponse(command.getText(), command.getAdminId());

        Ticket saved = ticketRepository.save(ticket);
        List<AdminResponse> responses = saved.getResponses();
        AdminResponse stored = responses.get(responses.size() - 1);

        log.info("✅ Response added - ticketId: {}, responseId: {}, adminId: {}",
                saved.getId(), stored.getId(), stored.getAdminId());

        return publication.publishAfterPersist(stored, TicketResponseAddedEvent.from(saved.getId(), stored));
    }
}
