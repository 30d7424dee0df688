package org.example.ticketservice.domain;

import lombok.Getter;
import org.example.ticketservice.exception.InvalidPriorityTransitionException;
import org.example.ticketservice.exception.InvalidTicketDataException;
import org.example.ticketservice.exception.InvalidTicketTransitionException;
import org.example.ticketservice.exception.PermissionDeniedException;
import org.example.ticketservice.exception.TicketAlreadyClosedException;
import org.example.ticketservice.exception.UnknownTicketStateException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ticket aggregate root.
 *
 * <p>All mutations go through the methods below, which either apply the
 * change completely or throw without touching any field. Requests that would
 * leave the ticket as it already is succeed and return an empty change, so
 * callers know there is nothing to persist or announce.</p>
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>Status moves only OPEN → IN_PROGRESS → CLOSED</li>
 *   <li>A CLOSED ticket accepts no status, priority or response change</li>
 *   <li>Priority leaves UNASSIGNED once and never returns to it</li>
 *   <li>Only administrators change priority</li>
 *   <li>Responses are append-only and keep insertion order</li>
 * </ul>
 */
@Getter
public class Ticket {

    public static final int MAX_TITLE_LENGTH = 255;

    private final Long id;
    private final String title;
    private final String description;
    private final String userId;
    private TicketStatus status;
    private TicketPriority priority;
    private String priorityJustification;
    private final List<AdminResponse> responses;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    private Ticket(Long id, String title, String description, String userId,
                   TicketStatus status, TicketPriority priority, String priorityJustification,
                   List<AdminResponse> responses, LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.userId = userId;
        this.status = status;
        this.priority = priority;
        this.priorityJustification = priorityJustification;
        this.responses = new ArrayList<>(responses);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    // ==================== FACTORIES ====================

    /**
     * Creates a new, not yet persisted ticket in status OPEN with priority UNASSIGNED.
     *
     * @throws InvalidTicketDataException if title, description or owner is blank
     */
    public static Ticket create(String title, String description, String userId) {
        if (title == null || title.isBlank()) {
            throw new InvalidTicketDataException("title", "Title is required");
        }
        if (characterCount(title.trim()) > MAX_TITLE_LENGTH) {
            throw new InvalidTicketDataException("title",
                    "Title must not exceed " + MAX_TITLE_LENGTH + " characters");
        }
        if (description == null || description.isBlank()) {
            throw new InvalidTicketDataException("description", "Description is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidTicketDataException("user_id", "Ticket owner is required");
        }
        return new Ticket(null, title.trim(), description.trim(), userId.trim(),
                TicketStatus.OPEN, TicketPriority.UNASSIGNED, null,
                List.of(), null, null);
    }

    /**
     * Rebuilds a ticket from stored state. Creation rules are not re-applied.
     */
    public static Ticket restore(Long id, String title, String description, String userId,
                                 TicketStatus status, TicketPriority priority, String priorityJustification,
                                 List<AdminResponse> responses, LocalDateTime createdAt, LocalDateTime updatedAt) {
        return new Ticket(id, title, description, userId, status, priority, priorityJustification,
                responses, createdAt, updatedAt);
    }

    // ==================== STATUS ====================

    /**
     * Parses and applies a requested status.
     *
     * @throws UnknownTicketStateException if the value names no status
     */
    public Optional<StatusChange> changeStatus(String requestedStatus) {
        return changeStatus(TicketStatus.fromValue(requestedStatus));
    }

    public Optional<StatusChange> changeStatus(TicketStatus newStatus) {
        if (newStatus == null) {
            throw new UnknownTicketStateException("null");
        }
        if (newStatus == status) {
            return Optional.empty();
        }
        if (status.isTerminal()) {
            throw new TicketAlreadyClosedException(id, "change status");
        }
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidTicketTransitionException(status.name(), newStatus.name());
        }
        TicketStatus oldStatus = status;
        status = newStatus;
        return Optional.of(new StatusChange(oldStatus, newStatus));
    }

    // ==================== PRIORITY ====================

    public Optional<PriorityChange> changePriority(TicketPriority newPriority, String justification,
                                                   UserRole requesterRole) {
        if (requesterRole == null || !requesterRole.canChangePriority()) {
            throw new PermissionDeniedException("change ticket priority", String.valueOf(requesterRole));
        }
        if (status.isTerminal()) {
            throw new TicketAlreadyClosedException(id, "change priority");
        }
        if (newPriority == null) {
            throw new InvalidTicketDataException("priority", "Priority is required");
        }
        if (newPriority == TicketPriority.UNASSIGNED && priority.isAssigned()) {
            throw new InvalidPriorityTransitionException(priority.getLabel(), newPriority.getLabel());
        }
        if (newPriority == priority) {
            return Optional.empty();
        }
        TicketPriority oldPriority = priority;
        String normalizedJustification = justification == null ? "" : justification.trim();
        priority = newPriority;
        priorityJustification = normalizedJustification;
        return Optional.of(new PriorityChange(oldPriority, newPriority, normalizedJustification));
    }

    // ==================== RESPONSES ====================

    /**
     * Appends an administrator response.
     *
     * @return the appended response, without id until the ticket is saved
     */
    public AdminResponse addResponse(String text, String adminId) {
        if (text == null || text.isBlank()) {
            throw new InvalidTicketDataException("text", "Response text is required");
        }
        if (characterCount(text) > AdminResponse.MAX_TEXT_LENGTH) {
            throw new InvalidTicketDataException("text",
                    "Response text must not exceed " + AdminResponse.MAX_TEXT_LENGTH + " characters");
        }
        if (adminId == null || adminId.isBlank()) {
            throw new InvalidTicketDataException("admin_id", "Responding admin is required");
        }
        if (status.isTerminal()) {
            throw new TicketAlreadyClosedException(id, "add response");
        }
        AdminResponse response = AdminResponse.builder()
                .text(text)
                .adminId(adminId)
                .build();
        responses.add(response);
        return response;
    }

    public List<AdminResponse> getResponses() {
        return Collections.unmodifiableList(responses);
    }

    public boolean isNew() {
        return id == null;
    }

    // code points, so a character outside the BMP counts once
    private static int characterCount(String value) {
        return value.codePointCount(0, value.length());
    }
}
