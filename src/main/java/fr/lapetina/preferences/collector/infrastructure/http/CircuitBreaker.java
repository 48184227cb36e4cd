package fr.lapetina.preferences.collector.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding the preference store.
 *
 * States:
 * - CLOSED: sends go through; consecutive failures are counted
 * - OPEN: failure threshold reached, sends fail fast until the recovery window ends
 * - HALF_OPEN: one probe send is let through; success closes, failure reopens
 *
 * Failing fast only shortens a flush while the store is down. Records that hit
 * an open circuit are still counted as failed sends and dropped.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String endpoint;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile Instant openedAt = Instant.MIN;

    public CircuitBreaker(String endpoint, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.endpoint = endpoint;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String endpoint, int failureThreshold, Duration recoveryTimeout) {
        this(endpoint, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    /**
     * Returns true if a send may be attempted now.
     * When the recovery window has elapsed, exactly one caller wins the probe slot.
     */
    public boolean tryAcquire() {
        return switch (state.get()) {
            case CLOSED -> true;
            case HALF_OPEN -> false;
            case OPEN -> {
                if (!recoveryElapsed()) {
                    yield false;
                }
                boolean probe = state.compareAndSet(State.OPEN, State.HALF_OPEN);
                if (probe) {
                    log.info("Circuit breaker HALF_OPEN, probing store: endpoint={}", endpoint);
                }
                yield probe;
            }
        };
    }

    public void onSuccess() {
        consecutiveFailures.set(0);
        if (state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            log.info("Circuit breaker CLOSED, store recovered: endpoint={}", endpoint);
        }
    }

    public void onFailure() {
        if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
            openedAt = clock.instant();
            log.warn("Circuit breaker re-OPENED, probe failed: endpoint={}", endpoint);
            return;
        }
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
            openedAt = clock.instant();
            log.warn("Circuit breaker OPENED: endpoint={}, consecutiveFailures={}, recoveryMs={}",
                    endpoint, failures, recoveryTimeout.toMillis());
        }
    }

    /**
     * Gives back a probe slot won by {@link #tryAcquire()} when the send was
     * abandoned before reaching the store. The next caller probes instead.
     */
    public void releaseProbe() {
        state.compareAndSet(State.HALF_OPEN, State.OPEN);
    }

    /**
     * Closes the circuit and clears the failure count.
     */
    public void reset() {
        State previous = state.getAndSet(State.CLOSED);
        consecutiveFailures.set(0);
        if (previous != State.CLOSED) {
            log.info("Circuit breaker reset from {}: endpoint={}", previous, endpoint);
        }
    }

    private boolean recoveryElapsed() {
        return !clock.instant().isBefore(openedAt.plus(recoveryTimeout));
    }

    public State getState() {
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "endpoint='" + endpoint + '\'' +
                ", state=" + state.get() +
                ", consecutiveFailures=" + consecutiveFailures.get() +
                '}';
    }
}
