package com.cabbooking.api_gateway.loadbalancer;

import com.cabbooking.api_gateway.registry.Instance;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Strict, unweighted round robin over the healthy instances of one service.
 *
 * The instance list is the service's live list, so instances added or removed by
 * an administrator, and health flags flipped by the checker or the router, are
 * picked up on the very next call. The cursor is reduced modulo the size of the
 * healthy set as it is at that moment, so a shrinking set never indexes out of range.
 */
public class RoundRobinInstanceSelector implements InstanceSelector {

    private final List<Instance> instances;
    private final AtomicInteger cursor = new AtomicInteger();

    public RoundRobinInstanceSelector(List<Instance> instances) {
        this.instances = instances;
    }

    @Override
    public Instance next() {
        List<Instance> healthy = instances.stream()
                .filter(Instance::isHealthy)
                .toList();
        if (healthy.isEmpty()) {
            return null;
        }
        // floorMod keeps the index valid after the counter wraps past Integer.MAX_VALUE.
        int index = Math.floorMod(cursor.getAndIncrement(), healthy.size());
        return healthy.get(index);
    }
}
