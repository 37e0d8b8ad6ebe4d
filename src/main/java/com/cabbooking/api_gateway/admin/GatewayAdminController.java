package com.cabbooking.api_gateway.admin;

import com.cabbooking.api_gateway.registry.ServiceRegistry;
import com.cabbooking.api_gateway.registry.ServiceStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.Map;

/**
 * Administrative and status API of the gateway.
 *
 * All endpoints live under /gateway. This controller is matched by Spring MVC
 * before the catch-all ProxyController because it has an explicit mapping.
 * Unknown service names surface as ServiceNotFoundException and become a 404
 * in GatewayExceptionHandler.
 */
@RestController
@RequestMapping("/gateway")
public class GatewayAdminController {

    private final ServiceRegistry registry;
    private final Clock clock;

    public GatewayAdminController(ServiceRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * GET /gateway/status
     * Instances with their health, breaker state and failure count, per service.
     */
    @GetMapping("/status")
    public Map<String, ServiceStatus> status() {
        return registry.getStatus();
    }

    /**
     * GET /gateway/metrics
     * The status snapshot plus a timestamp and the gateway's uptime.
     */
    @GetMapping("/metrics")
    public GatewayMetrics metrics() {
        return new GatewayMetrics(registry.getStatus(), clock.instant(),
                ManagementFactory.getRuntimeMXBean().getUptime());
    }

    /**
     * POST /gateway/services/{serviceName}/instances
     * Adds a backend instance. Returns 201 Created, or 200 OK when the address was already present.
     */
    @PostMapping("/services/{serviceName}/instances")
    public ResponseEntity<ServiceStatus> addInstance(@PathVariable String serviceName,
                                                     @RequestBody AddInstanceRequest body) {
        int weight = body.weight() != null ? body.weight() : 1;
        boolean added = registry.addInstance(serviceName, body.address(), weight);
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                .body(registry.getStatus().get(serviceName));
    }

    /**
     * DELETE /gateway/services/{serviceName}/instances?address=...
     * Removes a backend instance. Returns 204 No Content.
     */
    @DeleteMapping("/services/{serviceName}/instances")
    public ResponseEntity<Void> removeInstance(@PathVariable String serviceName, @RequestParam String address) {
        registry.removeInstance(serviceName, address);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /gateway/services/{serviceName}/circuit-breaker/reset
     * Forces the service's breaker back to CLOSED.
     */
    @PostMapping("/services/{serviceName}/circuit-breaker/reset")
    public ServiceStatus resetCircuitBreaker(@PathVariable String serviceName) {
        registry.resetCircuitBreaker(serviceName);
        return registry.getStatus().get(serviceName);
    }
}
