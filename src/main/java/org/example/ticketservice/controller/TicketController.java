package org.example.ticketservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.domain.AdminResponse;
import org.example.ticketservice.domain.Ticket;
import org.example.ticketservice.domain.UserRole;
import org.example.ticketservice.dto.TicketCreateRequest;
import org.example.ticketservice.dto.TicketDTO;
import org.example.ticketservice.dto.TicketPriorityUpdateRequest;
import org.example.ticketservice.dto.TicketResponseCreateRequest;
import org.example.ticketservice.dto.TicketResponseDTO;
import org.example.ticketservice.dto.TicketStatusUpdateRequest;
import org.example.ticketservice.mapper.TicketMapper;
import org.example.ticketservice.service.TicketQueryService;
import org.example.ticketservice.usecase.AddTicketResponseCommand;
import org.example.ticketservice.usecase.AddTicketResponseUseCase;
import org.example.ticketservice.usecase.ChangeTicketPriorityCommand;
import org.example.ticketservice.usecase.ChangeTicketPriorityUseCase;
import org.example.ticketservice.usecase.ChangeTicketStatusCommand;
import org.example.ticketservice.usecase.ChangeTicketStatusUseCase;
import org.example.ticketservice.usecase.CreateTicketCommand;
import org.example.ticketservice.usecase.CreateTicketUseCase;
import org.example.ticketservice.usecase.UseCaseResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;


@Slf4j
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLE_HEADER = "X-User-Role";

    private final CreateTicketUseCase createTicketUseCase;
    private final ChangeTicketStatusUseCase changeTicketStatusUseCase;
    private final ChangeTicketPriorityUseCase changeTicketPriorityUseCase;
    private final AddTicketResponseUseCase addTicketResponseUseCase;
    private final TicketQueryService ticketQueryService;
    private final TicketMapper ticketMapper;

    // ==================== CREATE ====================

    /**
     * Create a new ticket.
     * POST /api/tickets
     */
    @PostMapping
    public ResponseEntity<TicketDTO> createTicket(@Valid @RequestBody TicketCreateRequest request) {
        log.info("POST /api/tickets - Creating ticket for user {}", request.getUserId());
        UseCaseResult<Ticket> result = createTicketUseCase.execute(
                new CreateTicketCommand(request.getTitle(), request.getDescription(), request.getUserId()));
        return new ResponseEntity<>(ticketMapper.toDTO(completedValue(result)), HttpStatus.CREATED);
    }

    // ==================== READ ====================

    /**
     * List tickets, newest first, optionally filtered by status.
     * GET /api/tickets?status=OPEN
     */
    @GetMapping
    public ResponseEntity<List<TicketDTO>> listTickets(@RequestParam(required = false) String status) {
        log.debug("GET /api/tickets - status filter: {}", status);
        return ResponseEntity.ok(ticketQueryService.listTickets(status));
    }

    /**
     * GET /api/tickets/{id}
     */
    @GetMapping("/{id:\\d+}")
    public ResponseEntity<TicketDTO> getTicket(@PathVariable Long id) {
        log.debug("GET /api/tickets/{}", id);
        return ResponseEntity.ok(ticketQueryService.getTicket(id));
    }

    /**
     * GET /api/tickets/my-tickets/{userId}
     */
    @GetMapping("/my-tickets/{userId}")
    public ResponseEntity<List<TicketDTO>> getTicketsForUser(@PathVariable String userId) {
        log.debug("GET /api/tickets/my-tickets/{}", userId);
        return ResponseEntity.ok(ticketQueryService.getTicketsForUser(userId));
    }

    // ==================== UPDATE ====================

    /**
     * Update ticket status.
     * PATCH /api/tickets/{id}/status
     */
    @PatchMapping("/{id:\\d+}/status")
    public ResponseEntity<TicketDTO> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody TicketStatusUpdateRequest request) {
        log.info("PATCH /api/tickets/{}/status - {}", id, request.getStatus());
        UseCaseResult<Ticket> result = changeTicketStatusUseCase.execute(
                new ChangeTicketStatusCommand(id, request.getStatus()));
        return ResponseEntity.ok(ticketMapper.toDTO(completedValue(result)));
    }

    /**
     * Change ticket priority (administrators only).
     * PATCH /api/tickets/{id}/priority
     */
    @PatchMapping("/{id:\\d+}/priority")
    public ResponseEntity<TicketDTO> updatePriority(
            @PathVariable Long id,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody TicketPriorityUpdateRequest request) {
        log.info("PATCH /api/tickets/{}/priority - {} by role {}", id, request.getPriority(), role);
        UseCaseResult<Ticket> result = changeTicketPriorityUseCase.execute(
                new ChangeTicketPriorityCommand(id, request.getPriority(), request.getJustification(),
                        UserRole.fromValue(role)));
        return ResponseEntity.ok(ticketMapper.toDTO(completedValue(result)));
    }

    // ==================== RESPONSES ====================

    /**
     * Add an administrator response.
     * POST /api/tickets/{id}/responses
     */
    @PostMapping("/{id:\\d+}/responses")
    public ResponseEntity<TicketResponseDTO> addResponse(
            @PathVariable Long id,
            @RequestHeader(value = USER_ID_HEADER, required = false) String adminId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @RequestBody TicketResponseCreateRequest request) {
        log.info("POST /api/tickets/{}/responses - by {}", id, adminId);
        UseCaseResult<AdminResponse> result = addTicketResponseUseCase.execute(
                new AddTicketResponseCommand(id, request.getText(), adminId, UserRole.fromValue(role)));
        return new ResponseEntity<>(ticketMapper.toDTO(id, completedValue(result)), HttpStatus.CREATED);
    }

    /**
     * GET /api/tickets/{id}/responses
     */
    @GetMapping("/{id:\\d+}/responses")
    public ResponseEntity<List<TicketResponseDTO>> getResponses(@PathVariable Long id) {
        log.debug("GET /api/tickets/{}/responses", id);
        return ResponseEntity.ok(ticketQueryService.getResponses(id));
    }

    /**
     * A change that was stored but not announced is reported as a server error.
     */
    private <T> T completedValue(UseCaseResult<T> result) {
        if (result.getPublishFailure().isPresent()) {
            throw result.getPublishFailure().get();
        }
        return result.getValue();
    }
}
