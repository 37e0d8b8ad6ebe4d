package com.cabbooking.api_gateway.config;

import com.cabbooking.api_gateway.health.HealthChecker;
import com.cabbooking.api_gateway.health.HealthProbe;
import com.cabbooking.api_gateway.health.HttpHealthProbe;
import com.cabbooking.api_gateway.proxy.HttpTransport;
import com.cabbooking.api_gateway.proxy.ServiceRouteTable;
import com.cabbooking.api_gateway.registry.ServiceRegistry;
import com.cabbooking.api_gateway.routing.RequestRouter;
import com.cabbooking.api_gateway.routing.Transport;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires the routing core from {@link GatewayProperties}.
 *
 * Every configured service is registered before the web server accepts traffic.
 * A broken service definition fails startup with a ConfigurationException.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One client for proxying and probing; it pools connections internally.
    @Bean
    public HttpClient httpClient(GatewayProperties properties) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public ServiceRegistry serviceRegistry(GatewayProperties properties, Clock clock) {
        ServiceRegistry registry = new ServiceRegistry(clock);
        properties.getServices().forEach((name, service) -> registry.registerService(service.toServiceConfig(name)));
        log.info("Service registry loaded: {} services", properties.getServices().size());
        return registry;
    }

    @Bean
    public ServiceRouteTable serviceRouteTable(GatewayProperties properties) {
        ServiceRouteTable routeTable = new ServiceRouteTable();
        properties.getServices().forEach((name, service) -> {
            if (service.getPathPrefix() != null) {
                routeTable.register(service.getPathPrefix(), name);
            }
        });
        return routeTable;
    }

    @Bean
    public Transport transport(HttpClient httpClient) {
        return new HttpTransport(httpClient);
    }

    @Bean
    public RequestRouter requestRouter(ServiceRegistry registry, Transport transport,
                                       TimeLimiterRegistry timeLimiterRegistry) {
        return new RequestRouter(registry, transport, timeLimiterRegistry);
    }

    @Bean
    public HealthProbe healthProbe(HttpClient httpClient) {
        return new HttpHealthProbe(httpClient);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.health-check", name = "enabled", matchIfMissing = true)
    public ThreadPoolTaskScheduler healthCheckScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("health-checker-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    // SmartLifecycle: started after the context is refreshed, stopped on shutdown.
    @Bean
    @ConditionalOnProperty(prefix = "gateway.health-check", name = "enabled", matchIfMissing = true)
    public HealthChecker healthChecker(ServiceRegistry registry, HealthProbe healthProbe,
                                       ThreadPoolTaskScheduler healthCheckScheduler,
                                       GatewayProperties properties) {
        GatewayProperties.HealthCheck healthCheck = properties.getHealthCheck();
        return new HealthChecker(registry, healthProbe, healthCheckScheduler,
                healthCheck.getInterval(), healthCheck.getTimeout());
    }
}
