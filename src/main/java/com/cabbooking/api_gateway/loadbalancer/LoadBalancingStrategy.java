package com.cabbooking.api_gateway.loadbalancer;

import com.cabbooking.api_gateway.registry.Instance;

import java.util.List;

/**
 * Selection strategies a service can be configured with.
 * Bound from configuration in kebab case, e.g. {@code load-balancing: weighted-round-robin}.
 */
public enum LoadBalancingStrategy {

    /** Plain rotation over healthy instances. Weights are ignored. */
    ROUND_ROBIN,

    /** Smooth weighted rotation: an instance of weight 3 gets three picks for every one of a weight-1 peer. */
    WEIGHTED_ROUND_ROBIN;

    public InstanceSelector createSelector(List<Instance> instances) {
        return switch (this) {
            case ROUND_ROBIN -> new RoundRobinInstanceSelector(instances);
            case WEIGHTED_ROUND_ROBIN -> new WeightedRoundRobinInstanceSelector(instances);
        };
    }
}
