package org.example.ticketservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for posting an administrator response.
 * Text bounds are enforced by the ticket itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketResponseCreateRequest {

    private String text;
}
