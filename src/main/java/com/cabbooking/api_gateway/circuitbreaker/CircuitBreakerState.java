package com.cabbooking.api_gateway.circuitbreaker;

public enum CircuitBreakerState {
    /** Normal operation. Every request is let through and failures are counted. */
    CLOSED,
    /** Tripped. Requests fail fast until the recovery timeout has elapsed. */
    OPEN,
    /** Recovery probing. Exactly one trial request may be in flight; everything else is rejected. */
    HALF_OPEN
}
