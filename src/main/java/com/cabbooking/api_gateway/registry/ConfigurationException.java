package com.cabbooking.api_gateway.registry;

/**
 * Thrown when a service definition is invalid or clashes with an existing one.
 * Fatal to the call that triggered it, never to the gateway.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
