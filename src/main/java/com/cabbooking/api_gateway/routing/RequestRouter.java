package com.cabbooking.api_gateway.routing;

import com.cabbooking.api_gateway.circuitbreaker.CircuitBreaker;
import com.cabbooking.api_gateway.loadbalancer.InstanceSelector;
import com.cabbooking.api_gateway.registry.Instance;
import com.cabbooking.api_gateway.registry.ServiceConfig;
import com.cabbooking.api_gateway.registry.ServiceRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Routes one request to a logical service.
 *
 * Per attempt:
 * 1. Ask the service's circuit breaker; if it refuses, fail with circuit_open.
 * 2. Ask the selector for a healthy instance; if there is none, fail with no_healthy_instances.
 * 3. Hand the call to the transport, bounded by the service's request timeout.
 * 4. Any response counts as a success for the breaker and marks the instance healthy.
 *    A timeout or transport error counts as a failure and takes the instance out of
 *    rotation at once, without waiting for the next health check.
 *
 * Failed attempts are retried up to maxRetries times, each retry going through
 * all four steps again, so it can land on another instance or be stopped by a
 * breaker that opened in the meantime. Only the last attempt's result reaches the caller.
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final ServiceRegistry registry;
    private final Transport transport;
    private final TimeLimiterRegistry timeLimiterRegistry;

    public RequestRouter(ServiceRegistry registry, Transport transport, TimeLimiterRegistry timeLimiterRegistry) {
        this.registry = registry;
        this.transport = transport;
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    /**
     * @return the upstream response of the first successful attempt
     * @throws ServiceUnavailableException when the breaker is open, no instance is healthy
     *                                     or all attempts failed
     * @throws com.cabbooking.api_gateway.registry.ServiceNotFoundException if the service is unknown
     */
    public UpstreamResponse route(String serviceName, ForwardRequest request) {
        ServiceConfig config = registry.getConfig(serviceName);
        CircuitBreaker breaker = registry.circuitBreaker(serviceName);
        InstanceSelector selector = registry.selector(serviceName);
        TimeLimiter timeLimiter = timeLimiterFor(config);

        int attempts = config.getMaxRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!breaker.allowRequest()) {
                log.debug("{} {} -> {} rejected: circuit {}", request.method(), request.pathAndQuery(),
                        serviceName, breaker.getState());
                throw new ServiceUnavailableException(serviceName, UnavailableReason.CIRCUIT_OPEN);
            }

            // Every admitted attempt must end in recordSuccess, recordFailure or releasePermission,
            // otherwise a HALF_OPEN trial slot stays taken forever.
            boolean recorded = false;
            try {
                Instance instance = selector.next();
                if (instance == null) {
                    log.warn("No healthy instances available for {}", serviceName);
                    throw new ServiceUnavailableException(serviceName, UnavailableReason.NO_HEALTHY_INSTANCES);
                }

                log.debug("{} {} -> {} (attempt {}/{})", request.method(), request.pathAndQuery(),
                        instance.getAddress(), attempt, attempts);
                RoutingOutcome outcome = send(timeLimiter, instance, request, config.getRequestTimeout());

                if (outcome.isSuccess()) {
                    breaker.recordSuccess();
                    recorded = true;
                    instance.markHealthy();
                    return outcome.response();
                }

                breaker.recordFailure();
                recorded = true;
                instance.recordFailure();
                log.warn("Proxy error for {} at {} (attempt {}/{}): {} {}", serviceName, instance.getAddress(),
                        attempt, attempts, outcome.kind(), outcome.detail());
            } finally {
                if (!recorded) {
                    breaker.releasePermission();
                }
            }

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        throw new ServiceUnavailableException(serviceName, UnavailableReason.UPSTREAM_UNAVAILABLE);
    }

    private RoutingOutcome send(TimeLimiter timeLimiter, Instance instance, ForwardRequest request,
                                Duration timeout) {
        try {
            // The time limiter cancels the transport future on timeout. A response that
            // shows up later is dropped with it and never reaches the breaker.
            UpstreamResponse response = timeLimiter.executeFutureSupplier(
                    () -> transport.send(instance.getAddress(), request, timeout));
            if (response == null) {
                return RoutingOutcome.transportFailure(instance, "empty response");
            }
            return RoutingOutcome.success(instance, response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RoutingOutcome.transportFailure(instance, "interrupted");
        } catch (Exception e) {
            return classify(instance, e);
        }
    }

    private static RoutingOutcome classify(Instance instance, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String detail = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return RoutingOutcome.timeout(instance, detail);
        }
        return RoutingOutcome.transportFailure(instance, detail);
    }

    private TimeLimiter timeLimiterFor(ServiceConfig config) {
        return timeLimiterRegistry.timeLimiter(config.getServiceName(), TimeLimiterConfig.custom()
                .timeoutDuration(config.getRequestTimeout())
                .cancelRunningFuture(true)
                .build());
    }
}
