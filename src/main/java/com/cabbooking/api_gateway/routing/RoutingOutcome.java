package com.cabbooking.api_gateway.routing;

import com.cabbooking.api_gateway.registry.Instance;

/**
 * Classified result of a single attempt against one instance.
 *
 * A SUCCESS means the backend process answered, which includes 4xx and 5xx
 * responses. Only the absence of an answer counts against the breaker.
 */
public record RoutingOutcome(Kind kind, Instance instance, UpstreamResponse response, String detail) {

    public enum Kind {
        SUCCESS,
        TRANSPORT_FAILURE,
        TIMEOUT
    }

    public static RoutingOutcome success(Instance instance, UpstreamResponse response) {
        return new RoutingOutcome(Kind.SUCCESS, instance, response, null);
    }

    public static RoutingOutcome transportFailure(Instance instance, String detail) {
        return new RoutingOutcome(Kind.TRANSPORT_FAILURE, instance, null, detail);
    }

    public static RoutingOutcome timeout(Instance instance, String detail) {
        return new RoutingOutcome(Kind.TIMEOUT, instance, null, detail);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
