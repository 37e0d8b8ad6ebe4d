package com.cabbooking.api_gateway.loadbalancer;

import com.cabbooking.api_gateway.registry.Instance;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Smooth weighted round robin (the nginx algorithm) over healthy instances.
 *
 * Every call adds each healthy instance's weight to its running score, picks the
 * highest score and subtracts the total weight from the winner. Over any window of
 * sum(weights) calls each instance is picked exactly weight times, interleaved
 * rather than in bursts. Scores are per-selector state, so calls are serialized.
 */
public class WeightedRoundRobinInstanceSelector implements InstanceSelector {

    private final List<Instance> instances;
    private final Map<Instance, Integer> currentWeights = new IdentityHashMap<>();

    public WeightedRoundRobinInstanceSelector(List<Instance> instances) {
        this.instances = instances;
    }

    @Override
    public synchronized Instance next() {
        List<Instance> healthy = instances.stream()
                .filter(Instance::isHealthy)
                .toList();
        if (healthy.isEmpty()) {
            return null;
        }

        // Forget scores of instances that were removed from the service.
        currentWeights.keySet().retainAll(instances);

        int totalWeight = 0;
        Instance best = null;
        int bestScore = Integer.MIN_VALUE;
        for (Instance instance : healthy) {
            int score = currentWeights.getOrDefault(instance, 0) + instance.getWeight();
            currentWeights.put(instance, score);
            totalWeight += instance.getWeight();
            if (score > bestScore) {
                best = instance;
                bestScore = score;
            }
        }
        currentWeights.put(best, bestScore - totalWeight);
        return best;
    }
}
