package com.cabbooking.api_gateway.admin;

import com.cabbooking.api_gateway.registry.ServiceStatus;

import java.time.Instant;
import java.util.Map;

public record GatewayMetrics(Map<String, ServiceStatus> services, Instant timestamp, long uptimeMs) {}
