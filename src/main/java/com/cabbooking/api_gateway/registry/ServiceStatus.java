package com.cabbooking.api_gateway.registry;

import com.cabbooking.api_gateway.circuitbreaker.CircuitBreakerState;

import java.util.List;

/**
 * Snapshot of one service as served by the status endpoint.
 */
public record ServiceStatus(
        List<InstanceStatus> instances,
        CircuitBreakerState breakerState,
        int failureCount,
        int healthyInstances,
        int totalInstances
) {}
