package com.cabbooking.api_gateway.health;

import com.cabbooking.api_gateway.registry.Instance;
import com.cabbooking.api_gateway.registry.ServiceConfig;
import com.cabbooking.api_gateway.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes every instance of every registered service and updates its health flag.
 *
 * The {@link TaskScheduler} fires a tick every {@code interval}. A tick only dispatches
 * asynchronous probes, so a slow instance never delays the others. An instance whose
 * previous probe is still running is skipped for that tick, which keeps probes of
 * the same instance from overlapping.
 *
 * Probe failures only flip {@link Instance#isHealthy()}. They are logged, never
 * thrown, and never reported to the circuit breaker: health is per instance, the
 * breaker is per service and driven by real traffic.
 *
 * The first tick runs one interval after {@link #start()}, so freshly registered
 * instances are presumed healthy until then.
 */
public class HealthChecker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final Duration timeout;

    // Identity-based: Instance does not override equals.
    private final Set<Instance> inFlight = ConcurrentHashMap.newKeySet();

    private ScheduledFuture<?> schedule;

    public HealthChecker(ServiceRegistry registry, HealthProbe probe, TaskScheduler taskScheduler,
                         Duration interval, Duration timeout) {
        this.registry = registry;
        this.probe = probe;
        this.taskScheduler = taskScheduler;
        this.interval = interval;
        this.timeout = timeout;
    }

    @Override
    public synchronized void start() {
        if (schedule != null) {
            return;
        }
        schedule = taskScheduler.scheduleAtFixedRate(this::tick, Instant.now().plus(interval), interval);
        log.info("Health checker started: interval={}, probe timeout={}", interval, timeout);
    }

    @Override
    public synchronized void stop() {
        if (schedule == null) {
            return;
        }
        schedule.cancel(true);
        schedule = null;
        log.info("Health checker stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return schedule != null;
    }

    /**
     * Runs one health check round and returns once every probe has been dispatched.
     * The returned future completes when all probes dispatched by this round have finished.
     */
    public CompletableFuture<Void> checkAll() {
        return CompletableFuture.allOf(registry.services().stream()
                .flatMap(config -> config.getInstances().stream()
                        .map(instance -> check(config, instance)))
                .toArray(CompletableFuture[]::new));
    }

    // Errors escaping a tick are logged by the scheduler's error handler; the schedule keeps running.
    private void tick() {
        log.debug("Health check tick");
        checkAll();
    }

    private CompletableFuture<Void> check(ServiceConfig config, Instance instance) {
        if (!inFlight.add(instance)) {
            log.debug("Previous probe of {} still running, skipping", instance.getAddress());
            return CompletableFuture.completedFuture(null);
        }
        String url = instance.getAddress() + config.getHealthCheckPath();
        CompletableFuture<Integer> result = null;
        try {
            result = probe.probe(url, timeout).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        } finally {
            // An Error thrown by the probe itself leaves nothing to complete the in-flight marker.
            if (result == null) {
                inFlight.remove(instance);
            }
        }
        return result.handle((status, error) -> {
            try {
                apply(config.getServiceName(), instance, url, status, error);
            } finally {
                inFlight.remove(instance);
            }
            return null;
        });
    }

    private void apply(String serviceName, Instance instance, String url, Integer status, Throwable error) {
        if (error == null && status != null && status == 200) {
            if (!instance.isHealthy()) {
                log.info("Instance {} of {} is healthy again", instance.getAddress(), serviceName);
            }
            instance.markHealthy();
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        String reason = cause != null
                ? cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "")
                : "HTTP " + status;
        log.warn("Health check failed for {} at {}: {}", serviceName, url, reason);
        instance.markUnhealthy();
    }
}
