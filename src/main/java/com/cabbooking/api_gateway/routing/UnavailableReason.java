package com.cabbooking.api_gateway.routing;

/**
 * Machine-readable reason attached to every 503 the gateway produces.
 */
public enum UnavailableReason {

    /** The service's circuit breaker rejected the request; no backend was contacted. */
    CIRCUIT_OPEN("circuit_open"),

    /** Every instance of the service is currently marked unhealthy. */
    NO_HEALTHY_INSTANCES("no_healthy_instances"),

    /** Every attempt, retries included, ended in a transport failure or timeout. */
    UPSTREAM_UNAVAILABLE("upstream_unavailable");

    private final String code;

    UnavailableReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
