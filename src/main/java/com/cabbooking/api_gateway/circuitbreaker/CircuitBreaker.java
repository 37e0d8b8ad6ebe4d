package com.cabbooking.api_gateway.circuitbreaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Consecutive-failure circuit breaker guarding one logical service.
 *
 * <pre>
 *   CLOSED    --threshold consecutive failures-->  OPEN
 *   OPEN      --first allowRequest() after recoveryTimeout--> HALF_OPEN (that call is the trial)
 *   HALF_OPEN --trial succeeds--> CLOSED
 *   HALF_OPEN --trial fails-->    OPEN (recovery timer restarts)
 * </pre>
 *
 * The breaker tracks whether the backend process answers at all, not whether it
 * answers with a 2xx. Every method is synchronized on the breaker, so the
 * transitions are linearizable per service and concurrent callers racing for the
 * HALF_OPEN trial see exactly one winner.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private boolean halfOpenTrialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.name = requireNonNull(name, "name");
        this.recoveryTimeout = requireNonNull(recoveryTimeout, "recoveryTimeout");
        this.clock = requireNonNull(clock, "clock");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Decides whether a request may contact the backend.
     *
     * While OPEN this returns false until the recovery timeout has elapsed; the
     * first call after that moves the breaker to HALF_OPEN and is admitted as the
     * trial. While the trial is in flight every other call is rejected.
     */
    public synchronized boolean allowRequest() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> {
                if (Duration.between(openedAt, clock.instant()).compareTo(recoveryTimeout) < 0) {
                    yield false;
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
                halfOpenTrialInFlight = true;
                yield true;
            }
            case HALF_OPEN -> {
                if (halfOpenTrialInFlight) {
                    yield false;
                }
                halfOpenTrialInFlight = true;
                yield true;
            }
        };
    }

    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                failureCount = 0;
                halfOpenTrialInFlight = false;
                transitionTo(CircuitBreakerState.CLOSED);
            }
            case OPEN -> {
                // Late result of a call admitted before the breaker tripped.
            }
        }
    }

    public synchronized void recordFailure() {
        switch (state) {
            case CLOSED -> {
                failureCount++;
                if (failureCount >= failureThreshold) {
                    open();
                }
            }
            case HALF_OPEN -> {
                failureCount++;
                halfOpenTrialInFlight = false;
                open();
            }
            case OPEN -> {
                // Already open: the recovery timer is not extended by stragglers.
            }
        }
    }

    /**
     * Gives back a HALF_OPEN trial slot that was granted but never used, e.g. when
     * no healthy instance could be selected. Without this the breaker would wait
     * forever for a trial result that is never going to arrive.
     */
    public synchronized void releasePermission() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            halfOpenTrialInFlight = false;
        }
    }

    /**
     * Administrative override: forces the breaker back to CLOSED with a clean count.
     */
    public synchronized void reset() {
        failureCount = 0;
        openedAt = null;
        halfOpenTrialInFlight = false;
        if (state != CircuitBreakerState.CLOSED) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
        log.info("[{}] circuit breaker reset", name);
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * State and failure count read under one lock, so they always belong together.
     */
    public synchronized Snapshot snapshot() {
        return new Snapshot(state, failureCount);
    }

    public synchronized boolean isHalfOpenTrialInFlight() {
        return halfOpenTrialInFlight;
    }

    public String getName() {
        return name;
    }

    public record Snapshot(CircuitBreakerState state, int failureCount) {}

    private void open() {
        openedAt = clock.instant();
        transitionTo(CircuitBreakerState.OPEN);
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        if (next == CircuitBreakerState.OPEN) {
            log.warn("[{}] circuit {} -> OPEN after {} failure(s), retrying in {}",
                    name, previous, failureCount, recoveryTimeout);
        } else {
            log.info("[{}] circuit {} -> {}", name, previous, next);
        }
    }
}
