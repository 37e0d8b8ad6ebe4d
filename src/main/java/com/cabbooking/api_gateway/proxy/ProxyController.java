package com.cabbooking.api_gateway.proxy;

import com.cabbooking.api_gateway.routing.ForwardRequest;
import com.cabbooking.api_gateway.routing.RequestRouter;
import com.cabbooking.api_gateway.routing.UpstreamResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Catch-all proxy controller.
 *
 * Every request that doesn't match a more specific mapping (e.g. /gateway/**)
 * falls through to this controller. It resolves the logical service from the
 * request path, lets the RequestRouter pick an instance and forward the call,
 * and writes the upstream response back to the caller. Path and query are
 * forwarded unchanged.
 *
 * A ServiceUnavailableException from the router propagates to
 * GatewayExceptionHandler, which turns it into the 503 body.
 */
@RestController
@Order(Ordered.LOWEST_PRECEDENCE)
public class ProxyController {

    private static final Logger log = LoggerFactory.getLogger(ProxyController.class);

    static final String GATEWAY_NAME = "cab-booking-gateway";

    /**
     * Hop-by-hop headers must not be forwarded between proxies.
     * They describe a single TCP link, not the end-to-end message.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "host", "connection", "transfer-encoding", "te", "upgrade",
            "proxy-authorization", "proxy-authenticate", "keep-alive", "trailer"
    );

    private final ServiceRouteTable routeTable;
    private final RequestRouter requestRouter;

    public ProxyController(ServiceRouteTable routeTable, RequestRouter requestRouter) {
        this.routeTable = routeTable;
        this.requestRouter = requestRouter;
    }

    @RequestMapping("/**")
    public void proxy(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String requestPath = request.getRequestURI();
        String method = request.getMethod().toUpperCase();

        String serviceName = routeTable.findService(requestPath).orElse(null);
        if (serviceName == null) {
            response.setStatus(HttpServletResponse.SC_NOT_FOUND);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"error\": \"No route found for path: " + requestPath + "\"}");
            return;
        }

        String queryString = request.getQueryString();
        String pathAndQuery = requestPath + (queryString != null ? "?" + queryString : "");
        ForwardRequest forwardRequest = new ForwardRequest(method, pathAndQuery,
                outboundHeaders(request), request.getInputStream().readAllBytes());

        log.debug("Proxying {} {} -> {}", method, pathAndQuery, serviceName);
        UpstreamResponse upstream = requestRouter.route(serviceName, forwardRequest);

        response.setStatus(upstream.statusCode());
        // Pseudo-headers (:status etc.) are HTTP/2 framing and must not leak into an HTTP/1.1 response.
        upstream.headers().forEach((name, values) -> {
            if (!name.startsWith(":") && !HOP_BY_HOP_HEADERS.contains(name.toLowerCase())
                    && !name.equalsIgnoreCase("content-length")) {
                values.forEach(value -> response.addHeader(name, value));
            }
        });
        response.setHeader("X-Gateway-Processed", "true");
        response.setHeader("X-Service-Name", serviceName);
        if (upstream.body() != null) {
            response.getOutputStream().write(upstream.body());
        }
    }

    /**
     * Copies the caller's headers minus hop-by-hop ones and adds the gateway's own.
     */
    private Map<String, List<String>> outboundHeaders(HttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            String lower = name.toLowerCase();
            if (!HOP_BY_HOP_HEADERS.contains(lower) && !lower.equals("x-forwarded-for")
                    && !lower.equals("x-request-id")) {
                headers.put(name, new ArrayList<>(Collections.list(request.getHeaders(name))));
            }
        }
        String requestId = request.getHeader("X-Request-ID");
        headers.put("X-Gateway", List.of(GATEWAY_NAME));
        headers.put("X-Request-ID", List.of(requestId != null ? requestId : UUID.randomUUID().toString()));
        headers.put("X-Forwarded-For", List.of(extractClientIp(request)));
        return headers;
    }

    /**
     * Extracts the originating client IP address.
     *
     * Behind another proxy the client is the first entry of X-Forwarded-For;
     * otherwise it is the TCP peer.
     */
    private String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
