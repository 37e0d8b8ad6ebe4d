package com.cabbooking.api_gateway.proxy;

import com.cabbooking.api_gateway.routing.ForwardRequest;
import com.cabbooking.api_gateway.routing.Transport;
import com.cabbooking.api_gateway.routing.UpstreamResponse;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards requests with the JDK HttpClient.
 *
 * A single HttpClient is shared by every request; it keeps its own connection pool.
 * Every response, 5xx included, completes the future normally. Connection and
 * timeout errors complete it exceptionally.
 */
public class HttpTransport implements Transport {

    // HttpClient refuses to let callers set these; it manages them itself.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade"
    );

    private final HttpClient httpClient;

    public HttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<UpstreamResponse> send(String address, ForwardRequest request, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(address + request.pathAndQuery()))
                .timeout(timeout);

        request.headers().forEach((name, values) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                values.forEach(value -> builder.header(name, value));
            }
        });

        byte[] body = request.body();
        HttpRequest.BodyPublisher publisher = body == null || body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        builder.method(request.method(), publisher);

        return httpClient.sendAsync(builder.build(), BodyHandlers.ofByteArray())
                .thenApply(HttpTransport::toUpstreamResponse);
    }

    private static UpstreamResponse toUpstreamResponse(HttpResponse<byte[]> response) {
        return new UpstreamResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
