package com.cabbooking.api_gateway.registry;

import lombok.Getter;

/**
 * Thrown when a lookup names a service that was never registered.
 */
@Getter
public class ServiceNotFoundException extends ConfigurationException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName) {
        super("Service " + serviceName + " not configured");
        this.serviceName = serviceName;
    }
}
