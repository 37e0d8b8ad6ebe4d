package com.cabbooking.api_gateway.registry;

import com.cabbooking.api_gateway.loadbalancer.LoadBalancingStrategy;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Static routing configuration of one logical service plus its live instance list.
 *
 * Everything except the instance list is fixed after registration. The list is a
 * CopyOnWriteArrayList: selectors and the health checker iterate over a snapshot,
 * so admin add/remove calls never disturb a selection or a health tick in progress.
 */
@Getter
public class ServiceConfig {

    public static final String DEFAULT_HEALTH_CHECK_PATH = "/health";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_BREAKER_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofMinutes(1);

    private final String serviceName;
    private final String healthCheckPath;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final int breakerThreshold;
    private final Duration recoveryTimeout;
    private final LoadBalancingStrategy loadBalancing;

    @Getter(AccessLevel.NONE)
    private final List<Instance> instances = new CopyOnWriteArrayList<>();

    @Builder
    private ServiceConfig(String serviceName,
                          @Singular List<Instance> instances,
                          String healthCheckPath,
                          Duration requestTimeout,
                          Integer maxRetries,
                          Integer breakerThreshold,
                          Duration recoveryTimeout,
                          LoadBalancingStrategy loadBalancing) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new ConfigurationException("Service name must not be blank");
        }
        this.serviceName = serviceName;
        this.healthCheckPath = healthCheckPath != null ? healthCheckPath : DEFAULT_HEALTH_CHECK_PATH;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.breakerThreshold = breakerThreshold != null ? breakerThreshold : DEFAULT_BREAKER_THRESHOLD;
        this.recoveryTimeout = recoveryTimeout != null ? recoveryTimeout : DEFAULT_RECOVERY_TIMEOUT;
        this.loadBalancing = loadBalancing != null ? loadBalancing : LoadBalancingStrategy.ROUND_ROBIN;

        if (instances == null || instances.isEmpty()) {
            throw new ConfigurationException("Service " + serviceName + " needs at least one instance");
        }
        if (this.maxRetries < 0) {
            throw new ConfigurationException("maxRetries must be >= 0 for service " + serviceName);
        }
        if (this.breakerThreshold < 1) {
            throw new ConfigurationException("breakerThreshold must be >= 1 for service " + serviceName);
        }
        if (this.requestTimeout.isZero() || this.requestTimeout.isNegative()
                || this.recoveryTimeout.isZero() || this.recoveryTimeout.isNegative()) {
            throw new ConfigurationException("Timeouts must be positive for service " + serviceName);
        }
        for (Instance instance : instances) {
            addInstance(instance.getAddress(), instance.getWeight());
        }
    }

    /**
     * Read-only live view of the instances. Iteration works on a snapshot.
     */
    public List<Instance> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public Optional<Instance> findInstance(String address) {
        for (Instance instance : instances) {
            if (instance.getAddress().equals(address)) {
                return Optional.of(instance);
            }
        }
        return Optional.empty();
    }

    /**
     * Appends a new healthy instance.
     *
     * @return false if an instance with this address already exists
     */
    synchronized boolean addInstance(String address, int weight) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("Instance address must not be blank");
        }
        if (weight < 1) {
            throw new ConfigurationException("Instance weight must be >= 1, got " + weight);
        }
        if (findInstance(address).isPresent()) {
            return false;
        }
        instances.add(new Instance(address, weight));
        return true;
    }

    synchronized boolean removeInstance(String address) {
        return instances.removeIf(instance -> instance.getAddress().equals(address));
    }
}
