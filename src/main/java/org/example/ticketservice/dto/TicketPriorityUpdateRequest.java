package org.example.ticketservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for changing ticket priority.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketPriorityUpdateRequest {

    @NotBlank(message = "Priority is required")
    @Size(max = 20, message = "Priority must not exceed 20 characters")
    private String priority;

    @Size(max = 2000, message = "Justification must not exceed 2000 characters")
    private String justification;
}
