package org.example.ticketservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.TicketStatus;
import org.example.ticketservice.dto.TicketDTO;
import org.example.ticketservice.dto.TicketResponseDTO;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.mapper.TicketMapper;
import org.example.ticketservice.repository.TicketRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the ticket API. Never changes state or publishes events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketQueryService {

    private final TicketRepository ticketRepository;
    private final TicketMapper ticketMapper;

    public TicketDTO getTicket(Long id) {
        log.debug("Fetching ticket {}", id);
        return ticketMapper.toDTO(ticketRepository.findById(id));
    }

    /**
     * @param status optional filter; blank means all tickets
     * @throws org.example.ticketservice.exception.UnknownTicketStateException for an unknown status value
     */
    public List<TicketDTO> listTickets(String status) {
        if (status == null || status.isBlank()) {
            return ticketRepository.findAll().stream()
                    .map(ticketMapper::toDTO)
                    .toList();
        }
        TicketStatus ticketStatus = TicketStatus.fromValue(status);
        return ticketRepository.findByStatus(ticketStatus).stream()
                .map(ticketMapper::toDTO)
                .toList();
    }

    public List<TicketDTO> getTicketsForUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidTicketDataException("user_id", "User ID is required");
        }
        return ticketRepository.findByUserId(userId).stream()
                .map(ticketMapper::toDTO)
                .toList();
    }

    public List<TicketResponseDTO> getResponses(Long ticketId) {
        return ticketMapper.toResponseDTOs(ticketRepository.findById(ticketId));
    }
}
