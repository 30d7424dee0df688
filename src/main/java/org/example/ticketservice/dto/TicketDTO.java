package org.example.ticketservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.ticketservice.domain.TicketPriority;
import org.example.ticketservice.domain.TicketStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Data Transfer Object for Ticket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketDTO {

    private Long id;
    private String title;
    private String description;
    private TicketStatus status;
    private TicketPriority priority;
    private String priorityJustification;
    private String userId;
    private List<TicketResponseDTO> responses;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
