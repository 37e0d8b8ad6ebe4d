package com.cabbooking.api_gateway.registry;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One network endpoint backing a logical service.
 *
 * The address is the identity of the instance within its service. The health
 * flag is written by exactly two parties: the HealthChecker on every probe and
 * the RequestRouter right after a transport failure. Everyone else only reads it.
 */
@Getter
public class Instance {

    private final String address;
    private final int weight;

    // Volatile so a failure recorded on one request thread removes the instance
    // from the very next selection on any other thread.
    private volatile boolean healthy = true;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public Instance(String address, int weight) {
        this.address = address;
        this.weight = weight;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public void markHealthy() {
        consecutiveFailures.set(0);
        healthy = true;
    }

    public void markUnhealthy() {
        healthy = false;
    }

    /**
     * Marks the instance unhealthy after a failed request and bumps the failure streak.
     */
    public void recordFailure() {
        consecutiveFailures.incrementAndGet();
        healthy = false;
    }

    @Override
    public String toString() {
        return address + (healthy ? " (healthy)" : " (unhealthy)");
    }
}
