package com.cabbooking.api_gateway.registry;

import com.cabbooking.api_gateway.circuitbreaker.CircuitBreaker;
import com.cabbooking.api_gateway.loadbalancer.InstanceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every logical service the gateway routes to, together with the state the
 * gateway keeps for it: the live instance list, one circuit breaker and one
 * instance selector.
 *
 * Thread safety: the service map is a ConcurrentHashMap and registration uses
 * putIfAbsent, so concurrent registrations of the same name cannot both win.
 * Instance add/remove goes through the service's copy-on-write instance list,
 * which the selector and the health checker read directly. No rebuild or restart
 * of either is needed after a mutation.
 */
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    /**
     * Everything the gateway holds for one service. Created together, lives as long as the process.
     */
    private record RegisteredService(ServiceConfig config, CircuitBreaker circuitBreaker,
                                     InstanceSelector selector) {}

    private final Map<String, RegisteredService> services = new ConcurrentHashMap<>();
    private final Clock clock;

    public ServiceRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a service and creates its breaker and selector.
     *
     * @throws ConfigurationException if a service with the same name is already registered
     */
    public void registerService(ServiceConfig config) {
        CircuitBreaker breaker = new CircuitBreaker(config.getServiceName(), config.getBreakerThreshold(),
                config.getRecoveryTimeout(), clock);
        InstanceSelector selector = config.getLoadBalancing().createSelector(config.getInstances());

        RegisteredService existing = services.putIfAbsent(config.getServiceName(),
                new RegisteredService(config, breaker, selector));
        if (existing != null) {
            throw new ConfigurationException("Service " + config.getServiceName() + " is already registered");
        }
        log.info("Registered service {} with {} instance(s), strategy={}", config.getServiceName(),
                config.getInstances().size(), config.getLoadBalancing());
    }

    /**
     * @throws ServiceNotFoundException if the service is unknown
     */
    public ServiceConfig getConfig(String serviceName) {
        return lookup(serviceName).config();
    }

    public CircuitBreaker circuitBreaker(String serviceName) {
        return lookup(serviceName).circuitBreaker();
    }

    public InstanceSelector selector(String serviceName) {
        return lookup(serviceName).selector();
    }

    public boolean contains(String serviceName) {
        return services.containsKey(serviceName);
    }

    public Collection<ServiceConfig> services() {
        return services.values().stream().map(RegisteredService::config).toList();
    }

    /**
     * Adds a healthy instance to a running service. Does nothing if the address is already present.
     *
     * @return true if the instance was added
     */
    public boolean addInstance(String serviceName, String address, int weight) {
        boolean added = lookup(serviceName).config().addInstance(address, weight);
        if (added) {
            log.info("Added instance {} to service {} (weight={})", address, serviceName, weight);
        } else {
            log.debug("Instance {} already present in service {}", address, serviceName);
        }
        return added;
    }

    /**
     * Removes an instance. Requests already in flight to it complete normally;
     * it is simply never selected again.
     */
    public void removeInstance(String serviceName, String address) {
        if (lookup(serviceName).config().removeInstance(address)) {
            log.info("Removed instance {} from service {}", address, serviceName);
        } else {
            log.debug("Instance {} not present in service {}", address, serviceName);
        }
    }

    public void resetCircuitBreaker(String serviceName) {
        lookup(serviceName).circuitBreaker().reset();
    }

    /**
     * Point-in-time view of every service, ordered by service name.
     */
    public Map<String, ServiceStatus> getStatus() {
        Map<String, ServiceStatus> status = new LinkedHashMap<>();
        services.keySet().stream().sorted().forEach(name -> {
            RegisteredService service = services.get(name);
            List<InstanceStatus> instances = service.config().getInstances().stream()
                    .map(InstanceStatus::of)
                    .toList();
            CircuitBreaker.Snapshot breaker = service.circuitBreaker().snapshot();
            status.put(name, new ServiceStatus(
                    instances,
                    breaker.state(),
                    breaker.failureCount(),
                    (int) instances.stream().filter(InstanceStatus::healthy).count(),
                    instances.size()));
        });
        return status;
    }

    private RegisteredService lookup(String serviceName) {
        RegisteredService service = services.get(serviceName);
        if (service == null) {
            throw new ServiceNotFoundException(serviceName);
        }
        return service;
    }
}
