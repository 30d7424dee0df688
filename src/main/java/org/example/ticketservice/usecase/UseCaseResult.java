package org.example.ticketservice.usecase;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.example.ticketservice.exception.EventPublishException;

import java.util.Optional;

/**
 * Outcome of a use case.
 *
 * <p>Persistence always happens before publication, and a failed publication
 * never undoes the stored change. The two flags make that partial success
 * observable: {@code persisted && !published} means the state changed but the
 * notification may be lost.</p>
 *
 * @param <T> the value returned to the caller
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class UseCaseResult<T> {

    private final T value;
    private final boolean persisted;
    private final boolean published;
    private final EventPublishException publishFailure;

    public static <T> UseCaseResult<T> completed(T value) {
        return new UseCaseResult<>(value, true, true, null);
    }

    /**
     * The request matched the current state: nothing stored, nothing published.
     */
    public static <T> UseCaseResult<T> unchanged(T value) {
        return new UseCaseResult<>(value, false, false, null);
    }

    public static <T> UseCaseResult<T> publishFailed(T value, EventPublishException failure) {
        return new UseCaseResult<>(value, true, false, failure);
    }

    public boolean isChanged() {
        return persisted;
    }

    public Optional<EventPublishException> getPublishFailure() {
        return Optional.ofNullable(publishFailure);
    }
}
