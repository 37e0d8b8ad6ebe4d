package com.cabbooking.api_gateway.health;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Out-of-band availability check of a single instance.
 */
public interface HealthProbe {

    /**
     * Issues one health request.
     *
     * @param url     full health URL (instance address + health check path)
     * @param timeout upper bound for the whole probe
     * @return the HTTP status received; completes exceptionally on timeout or connection failure
     */
    CompletableFuture<Integer> probe(String url, Duration timeout);
}
