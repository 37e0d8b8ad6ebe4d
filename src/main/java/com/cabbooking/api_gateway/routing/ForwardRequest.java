package com.cabbooking.api_gateway.routing;

import java.util.List;
import java.util.Map;

/**
 * An inbound request as the router hands it to the transport.
 *
 * @param method      HTTP method, upper case
 * @param pathAndQuery original request path plus "?query" when present; forwarded unchanged
 * @param headers     headers to send upstream, hop-by-hop headers already removed
 * @param body        request body, empty for bodiless requests
 */
public record ForwardRequest(
        String method,
        String pathAndQuery,
        Map<String, List<String>> headers,
        byte[] body
) {}
