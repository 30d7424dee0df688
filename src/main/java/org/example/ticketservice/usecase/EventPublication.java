package org.example.ticketservice.usecase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.ticketservice.event.TicketEvent;
import org.example.ticketservice.event.TicketEventPublisher;
import org.example.ticketservice.exception.EventPublishException;

/**
 * Publishes the event for an already persisted change and folds the
 * publication outcome into a {@link UseCaseResult}.
 */
@Slf4j
@RequiredArgsConstructor
class EventPublication {

    private final TicketEventPublisher eventPublisher;

    <T> UseCaseResult<T> publishAfterPersist(T value, TicketEvent event) {
        try {
            eventPublisher.publish(event);
            return UseCaseResult.completed(value);
        } catch (EventPublishException e) {
            log.error("❌ PUBLISH FAILED - {} persisted but not announced: {}",
                    event, e.getDetailedDescription());
            return UseCaseResult.publishFailed(value, e);
        } catch (RuntimeException e) {
            log.error("❌ PUBLISH FAILED - {} persisted but not announced: {}", event, e.getMessage(), e);
            return UseCaseResult.publishFailed(value, new EventPublishException(
                    "Event publisher failed", null, event.getEventType(),
                    String.valueOf(event.getTicketId()), e));
        }
    }
}
