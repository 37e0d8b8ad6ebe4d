package com.cabbooking.api_gateway.routing;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the network call to one resolved instance.
 *
 * Any response that arrives, whatever its status code, completes the future
 * normally. Connection refusal, DNS failures, resets and timeouts complete it
 * exceptionally; the router turns those into a {@link RoutingOutcome}.
 */
public interface Transport {

    CompletableFuture<UpstreamResponse> send(String address, ForwardRequest request, Duration timeout);
}
