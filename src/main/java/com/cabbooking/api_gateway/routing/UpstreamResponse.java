package com.cabbooking.api_gateway.routing;

import java.util.List;
import java.util.Map;

public record UpstreamResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {}
