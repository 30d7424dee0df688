package org.example.ticketservice.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Reply written by an administrator on a ticket. Immutable once appended.
 */
@Value
@Builder
@AllArgsConstructor
public class AdminResponse {

    public static final int MAX_TEXT_LENGTH = 2000;

    /**
     * Assigned by the persistence layer; null until the owning ticket is saved.
     */
    Long id;

    String text;

    String adminId;

    LocalDateTime createdAt;
}
