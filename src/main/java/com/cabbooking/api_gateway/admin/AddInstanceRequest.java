package com.cabbooking.api_gateway.admin;

/**
 * Body of POST /gateway/services/{serviceName}/instances. Weight defaults to 1.
 */
public record AddInstanceRequest(String address, Integer weight) {}
