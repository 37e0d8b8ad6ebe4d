package com.cabbooking.api_gateway.loadbalancer;

import com.cabbooking.api_gateway.registry.Instance;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class WeightedRoundRobinInstanceSelectorTest {

    @Test
    void picksProportionallyToWeightAndInterleaves() {
        Instance heavy = new Instance("http://pricing-a:3008", 3);
        Instance light = new Instance("http://pricing-b:3008", 1);
        WeightedRoundRobinInstanceSelector selector =
                new WeightedRoundRobinInstanceSelector(new CopyOnWriteArrayList<>(List.of(heavy, light)));

        List<Instance> picks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            picks.add(selector.next());
        }

        assertThat(Collections.frequency(picks, heavy)).isEqualTo(6);
        assertThat(Collections.frequency(picks, light)).isEqualTo(2);
        // Smooth: the light instance is not starved for a whole cycle.
        assertThat(picks.subList(0, 4)).contains(light);
    }

    @Test
    void equalWeightsBehaveLikeRoundRobin() {
        Instance a = new Instance("http://a", 1);
        Instance b = new Instance("http://b", 1);
        WeightedRoundRobinInstanceSelector selector =
                new WeightedRoundRobinInstanceSelector(new CopyOnWriteArrayList<>(List.of(a, b)));

        assertThat(List.of(selector.next(), selector.next(), selector.next(), selector.next()))
                .containsExactly(a, b, a, b);
    }

    @Test
    void ignoresUnhealthyAndReturnsNullWhenNoneLeft() {
        Instance a = new Instance("http://a", 5);
        Instance b = new Instance("http://b", 1);
        WeightedRoundRobinInstanceSelector selector =
                new WeightedRoundRobinInstanceSelector(new CopyOnWriteArrayList<>(List.of(a, b)));

        a.markUnhealthy();
        for (int i = 0; i < 5; i++) {
            assertThat(selector.next()).isSameAs(b);
        }

        b.markUnhealthy();
        assertThat(selector.next()).isNull();
    }

    @Test
    void strategyCreatesMatchingSelector() {
        List<Instance> instances = new CopyOnWriteArrayList<>(List.of(new Instance("http://a", 1)));

        assertThat(LoadBalancingStrategy.ROUND_ROBIN.createSelector(instances))
                .isInstanceOf(RoundRobinInstanceSelector.class);
        assertThat(LoadBalancingStrategy.WEIGHTED_ROUND_ROBIN.createSelector(instances))
                .isInstanceOf(WeightedRoundRobinInstanceSelector.class);
    }
}
