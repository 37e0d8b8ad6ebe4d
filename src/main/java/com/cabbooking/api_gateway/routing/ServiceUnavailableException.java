package com.cabbooking.api_gateway.routing;

import lombok.Getter;

/**
 * The request could not be served by the named service. Always surfaced to the
 * caller as a 503; the router never retries it itself.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String serviceName;
    private final UnavailableReason reason;

    public ServiceUnavailableException(String serviceName, UnavailableReason reason) {
        super("Service " + serviceName + " unavailable: " + reason.code());
        this.serviceName = serviceName;
        this.reason = reason;
    }
}
