package com.cabbooking.api_gateway.registry;

public record InstanceStatus(String address, boolean healthy, int weight, int consecutiveFailures) {

    static InstanceStatus of(Instance instance) {
        return new InstanceStatus(instance.getAddress(), instance.isHealthy(), instance.getWeight(),
                instance.getConsecutiveFailures());
    }
}
