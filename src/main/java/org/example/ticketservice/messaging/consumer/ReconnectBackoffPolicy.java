package org.example.ticketservice.messaging.consumer;

import lombok.Getter;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;

/**
 * Bounded exponential reconnect backoff on top of Spring's {@link ExponentialBackOff}.
 *
 * <p>The n-th consecutive failure waits {@code min(initialDelay × factor^n, maxDelay)}.
 * There is no attempt limit; the consumer keeps reconnecting until stopped.
 * Each streak of failures uses its own {@link BackOffExecution} from {@link #start()}.</p>
 */
@Getter
public class ReconnectBackoffPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final Duration initialDelay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final ExponentialBackOff backOff;

    public ReconnectBackoffPolicy(Duration initialDelay, double backoffFactor, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than initialDelay");
        }
        this.initialDelay = initialDelay;
        this.backoffFactor = backoffFactor;
        this.maxDelay = maxDelay;

        // the first failure already waits one factor step past the initial delay
        long firstInterval = (long) Math.min(initialDelay.toMillis() * backoffFactor, maxDelay.toMillis());
        this.backOff = new ExponentialBackOff(firstInterval, backoffFactor);
        this.backOff.setMaxInterval(maxDelay.toMillis());
        this.backOff.setMaxElapsedTime(Long.MAX_VALUE);
    }

    public static ReconnectBackoffPolicy defaults() {
        return new ReconnectBackoffPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_DELAY);
    }

    /**
     * Begins a new streak of failures.
     */
    public BackOffExecution start() {
        return backOff.start();
    }

    /**
     * Delay before the next reconnect of the given streak. Falls back to the cap
     * if the execution ever reports {@link BackOffExecution#STOP}.
     */
    public Duration nextDelay(BackOffExecution execution) {
        long millis = execution.nextBackOff();
        if (millis == BackOffExecution.STOP) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
