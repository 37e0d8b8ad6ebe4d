package com.cabbooking.api_gateway.config;

import com.cabbooking.api_gateway.health.HealthChecker;
import com.cabbooking.api_gateway.loadbalancer.LoadBalancingStrategy;
import com.cabbooking.api_gateway.registry.Instance;
import com.cabbooking.api_gateway.registry.ServiceConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code gateway.*} in application.yaml.
 *
 * The service table is read once at startup; later changes to the instance
 * lists go through the admin API, not through configuration.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    // Connect timeout of the shared HttpClient used for proxying and health probes.
    private Duration connectTimeout = Duration.ofSeconds(5);

    private HealthCheck healthCheck = new HealthCheck();

    private Map<String, ServiceProperties> services = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class HealthCheck {
        private boolean enabled = true;
        private Duration interval = HealthChecker.DEFAULT_INTERVAL;
        private Duration timeout = HealthChecker.DEFAULT_TIMEOUT;
    }

    @Getter
    @Setter
    public static class ServiceProperties {
        // Inbound path prefix routed to this service, e.g. /api/rides. Optional.
        private String pathPrefix;
        private String healthCheckPath = ServiceConfig.DEFAULT_HEALTH_CHECK_PATH;
        private Duration requestTimeout = ServiceConfig.DEFAULT_REQUEST_TIMEOUT;
        private int maxRetries = ServiceConfig.DEFAULT_MAX_RETRIES;
        private int breakerThreshold = ServiceConfig.DEFAULT_BREAKER_THRESHOLD;
        private Duration recoveryTimeout = ServiceConfig.DEFAULT_RECOVERY_TIMEOUT;
        private LoadBalancingStrategy loadBalancing = LoadBalancingStrategy.ROUND_ROBIN;
        private List<InstanceProperties> instances = new ArrayList<>();

        public ServiceConfig toServiceConfig(String serviceName) {
            return ServiceConfig.builder()
                    .serviceName(serviceName)
                    .instances(instances.stream()
                            .map(i -> new Instance(i.getAddress(), i.getWeight()))
                            .toList())
                    .healthCheckPath(healthCheckPath)
                    .requestTimeout(requestTimeout)
                    .maxRetries(maxRetries)
                    .breakerThreshold(breakerThreshold)
                    .recoveryTimeout(recoveryTimeout)
                    .loadBalancing(loadBalancing)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class InstanceProperties {
        private String address;
        private int weight = 1;
    }
}
