package com.cabbooking.api_gateway.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps inbound path prefixes to logical service names.
 *
 * Built once from configuration. Lookups are longest-prefix matches on whole path
 * segments: with /api/rides and /api configured, /api/rides/42 resolves to the
 * rides service while /api/ridesharing falls back to /api.
 */
public class ServiceRouteTable {

    private static final Logger log = LoggerFactory.getLogger(ServiceRouteTable.class);

    private final Map<String, String> serviceByPrefix = new ConcurrentHashMap<>();

    public void register(String pathPrefix, String serviceName) {
        String normalized = normalize(pathPrefix);
        String previous = serviceByPrefix.putIfAbsent(normalized, serviceName);
        if (previous != null && !previous.equals(serviceName)) {
            throw new IllegalArgumentException("Path prefix " + normalized + " is already mapped to " + previous);
        }
        log.debug("Route {} -> {}", normalized, serviceName);
    }

    /**
     * @param requestPath the full path of the incoming HTTP request
     * @return the service owning the longest matching prefix, or empty if nothing matches
     */
    public Optional<String> findService(String requestPath) {
        return serviceByPrefix.keySet().stream()
                .filter(prefix -> matches(requestPath, prefix))
                .max((a, b) -> Integer.compare(a.length(), b.length()))
                .map(serviceByPrefix::get);
    }

    public Map<String, String> routes() {
        return Map.copyOf(serviceByPrefix);
    }

    private static boolean matches(String requestPath, String prefix) {
        if (prefix.equals("/")) {
            return true;
        }
        return requestPath.startsWith(prefix)
                && (requestPath.length() == prefix.length() || requestPath.charAt(prefix.length()) == '/');
    }

    private static String normalize(String pathPrefix) {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            throw new IllegalArgumentException("Path prefix must not be blank");
        }
        String prefix = pathPrefix.startsWith("/") ? pathPrefix : "/" + pathPrefix;
        while (prefix.length() > 1 && prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }
}
