package com.cabbooking.api_gateway.routing;

import com.cabbooking.api_gateway.circuitbreaker.CircuitBreaker;
import com.cabbooking.api_gateway.circuitbreaker.CircuitBreakerState;
import com.cabbooking.api_gateway.registry.Instance;
import com.cabbooking.api_gateway.registry.ServiceConfig;
import com.cabbooking.api_gateway.registry.ServiceNotFoundException;
import com.cabbooking.api_gateway.registry.ServiceRegistry;
import com.cabbooking.api_gateway.support.MutableClock;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RequestRouterTest {

    private static final String SERVICE = "ride-service";
    private static final String A = "http://ride-a:3005";
    private static final String B = "http://ride-b:3005";

    private static final ForwardRequest REQUEST =
            new ForwardRequest("GET", "/api/rides/42", Map.of(), new byte[0]);

    @Mock
    private Transport transport;

    private MutableClock clock;
    private ServiceRegistry registry;
    private RequestRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ServiceRegistry(clock);
        router = new RequestRouter(registry, transport, TimeLimiterRegistry.ofDefaults());
    }

    private void register(int maxRetries, int breakerThreshold, Duration requestTimeout) {
        registry.registerService(ServiceConfig.builder()
                .serviceName(SERVICE)
                .instance(new Instance(A, 1))
                .instance(new Instance(B, 1))
                .healthCheckPath("/api/rides/health")
                .requestTimeout(requestTimeout)
                .maxRetries(maxRetries)
                .breakerThreshold(breakerThreshold)
                .recoveryTimeout(Duration.ofMillis(1000))
                .build());
    }

    private Instance instance(String address) {
        return registry.getConfig(SERVICE).findInstance(address).orElseThrow();
    }

    private static CompletableFuture<UpstreamResponse> response(int status) {
        return CompletableFuture.completedFuture(
                new UpstreamResponse(status, Map.of("content-type", List.of("application/json")), "{}".getBytes()));
    }

    private static CompletableFuture<UpstreamResponse> refused() {
        return CompletableFuture.failedFuture(new ConnectException("Connection refused"));
    }

    private CircuitBreaker breaker() {
        return registry.circuitBreaker(SERVICE);
    }

    @Test
    @DisplayName("A response is returned and recorded as a success")
    void successfulRoute() {
        register(3, 3, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenReturn(response(200));

        UpstreamResponse result = router.route(SERVICE, REQUEST);

        assertThat(result.statusCode()).isEqualTo(200);
        verify(transport).send(eq(A), eq(REQUEST), eq(Duration.ofSeconds(1)));
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("Upstream 4xx/5xx responses count as successes for the breaker")
    void applicationErrorsAreSuccesses() {
        register(0, 1, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenReturn(response(500), response(404));

        assertThat(router.route(SERVICE, REQUEST).statusCode()).isEqualTo(500);
        assertThat(router.route(SERVICE, REQUEST).statusCode()).isEqualTo(404);

        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker().getFailureCount()).isZero();
        assertThat(instance(A).isHealthy()).isTrue();
        assertThat(instance(B).isHealthy()).isTrue();
    }

    @Test
    @DisplayName("A transport failure takes the instance out of rotation and the retry goes elsewhere")
    void failureMarksUnhealthyAndRetriesOnAnotherInstance() {
        register(3, 5, Duration.ofSeconds(1));
        when(transport.send(eq(A), any(), any())).thenReturn(refused());
        when(transport.send(eq(B), any(), any())).thenReturn(response(201));

        UpstreamResponse result = router.route(SERVICE, REQUEST);

        assertThat(result.statusCode()).isEqualTo(201);
        assertThat(instance(A).isHealthy()).isFalse();
        assertThat(instance(A).getConsecutiveFailures()).isEqualTo(1);
        assertThat(instance(B).isHealthy()).isTrue();
        // The failure was counted, then the success reset the count.
        assertThat(breaker().getFailureCount()).isZero();
    }

    @Test
    @DisplayName("Exhausted retries surface as upstream_unavailable; every attempt is recorded")
    void exhaustedRetries() {
        register(1, 10, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new UnknownHostException("ride-a")), refused());

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);

        verify(transport, times(2)).send(anyString(), any(), any());
        assertThat(breaker().getFailureCount()).isEqualTo(2);
        assertThat(instance(A).isHealthy()).isFalse();
        assertThat(instance(B).isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Retries stop with circuit_open once the breaker trips mid-sequence")
    void retriesShortCircuitWhenBreakerOpens() {
        register(5, 2, Duration.ofSeconds(1));
        registry.addInstance(SERVICE, "http://ride-c:3005", 1);
        when(transport.send(anyString(), any(), any())).thenReturn(refused());

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(UnavailableReason.CIRCUIT_OPEN);

        verify(transport, times(2)).send(anyString(), any(), any());
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    @DisplayName("With every instance unhealthy the request fails with no_healthy_instances")
    void noHealthyInstances() {
        register(3, 3, Duration.ofSeconds(1));
        instance(A).markUnhealthy();
        instance(B).markUnhealthy();

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(UnavailableReason.NO_HEALTHY_INSTANCES);

        verify(transport, never()).send(anyString(), any(), any());
        assertThat(breaker().getFailureCount()).isZero();
    }

    @Test
    @DisplayName("A trial slot granted while no instance is healthy is handed back")
    void unusedTrialIsReleased() {
        register(0, 1, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenReturn(refused());
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST)).isInstanceOf(ServiceUnavailableException.class);
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.OPEN);

        clock.forward(Duration.ofMillis(1000));
        instance(A).markUnhealthy();
        instance(B).markUnhealthy();
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .extracting("reason").isEqualTo(UnavailableReason.NO_HEALTHY_INSTANCES);
        assertThat(breaker().isHalfOpenTrialInFlight()).isFalse();

        instance(B).markHealthy();
        when(transport.send(anyString(), any(), any())).thenReturn(response(200));
        assertThat(router.route(SERVICE, REQUEST).statusCode()).isEqualTo(200);
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("A call exceeding the request timeout is a failure and its late answer is discarded")
    void timeoutIsAFailure() {
        register(0, 5, Duration.ofMillis(100));
        CompletableFuture<UpstreamResponse> hanging = new CompletableFuture<>();
        when(transport.send(anyString(), any(), any())).thenReturn(hanging);

        long start = System.nanoTime();
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(2000);
        assertThat(breaker().getFailureCount()).isEqualTo(1);
        assertThat(instance(A).isHealthy()).isFalse();

        // The abandoned call answering late changes nothing.
        hanging.complete(new UpstreamResponse(200, Map.of(), new byte[0]));
        assertThat(breaker().getFailureCount()).isEqualTo(1);
        assertThat(instance(A).isHealthy()).isFalse();
    }

    @Test
    void transportTimeoutExceptionIsAFailure() {
        register(0, 5, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new HttpTimeoutException("request timed out")));

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);
        assertThat(breaker().getFailureCount()).isEqualTo(1);
    }

    @Test
    void transportThrowingSynchronouslyIsAFailure() {
        register(0, 5, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenThrow(new IllegalArgumentException("bad uri"));

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);
        assertThat(breaker().getFailureCount()).isEqualTo(1);
    }

    @Test
    void unknownServiceIsRejected() {
        register(0, 5, Duration.ofSeconds(1));

        assertThatThrownBy(() -> router.route("teleport-service", REQUEST))
                .isInstanceOf(ServiceNotFoundException.class);
    }

    @Test
    @DisplayName("ride-service: 3 failures open the breaker, 503 without contact, trial after 1000ms closes it")
    void rideServiceBreakerScenario() {
        register(0, 3, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenReturn(refused());

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                    .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);
            // Stand-in for the health checker bringing the instances back between requests.
            instance(A).markHealthy();
            instance(B).markHealthy();
        }
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.OPEN);
        verify(transport, times(3)).send(anyString(), any(), any());

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(UnavailableReason.CIRCUIT_OPEN);
        verify(transport, times(3)).send(anyString(), any(), any());

        clock.forward(Duration.ofMillis(1000));
        when(transport.send(anyString(), any(), any())).thenReturn(response(200));

        assertThat(router.route(SERVICE, REQUEST).statusCode()).isEqualTo(200);
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker().getFailureCount()).isZero();
    }

    @Test
    @DisplayName("A trial that ends in an Error gives its slot back instead of wedging the breaker")
    void trialEndingInErrorReleasesSlot() {
        register(0, 1, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any()))
                .thenReturn(refused())
                .thenReturn(CompletableFuture.failedFuture(new StackOverflowError()))
                .thenReturn(response(200));

        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .isInstanceOf(ServiceUnavailableException.class);
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.OPEN);

        clock.forward(Duration.ofMillis(1000));
        instance(A).markHealthy();
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST)).isInstanceOf(StackOverflowError.class);

        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker().isHalfOpenTrialInFlight()).isFalse();

        assertThat(router.route(SERVICE, REQUEST).statusCode()).isEqualTo(200);
        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("A failed trial reopens the breaker")
    void failedTrialReopens() {
        register(0, 1, Duration.ofSeconds(1));
        when(transport.send(anyString(), any(), any())).thenReturn(refused());
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST)).isInstanceOf(ServiceUnavailableException.class);

        clock.forward(Duration.ofMillis(1000));
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .extracting("reason").isEqualTo(UnavailableReason.UPSTREAM_UNAVAILABLE);

        assertThat(breaker().getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> router.route(SERVICE, REQUEST))
                .extracting("reason").isEqualTo(UnavailableReason.CIRCUIT_OPEN);
    }

    @Test
    @DisplayName("Removing an instance mid-request lets that request finish; the instance is never picked again")
    void removeInstanceWhileInFlight() throws Exception {
        register(0, 5, Duration.ofSeconds(5));
        CountDownLatch inFlight = new CountDownLatch(1);
        CompletableFuture<UpstreamResponse> pending = new CompletableFuture<>();
        when(transport.send(eq(A), any(), any())).thenReturn(response(200));
        when(transport.send(eq(B), any(), any())).thenAnswer(invocation -> {
            inFlight.countDown();
            return pending;
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            // First pick goes to A, second to B.
            router.route(SERVICE, REQUEST);
            Future<UpstreamResponse> toB = pool.submit(() -> router.route(SERVICE, REQUEST));
            assertThat(inFlight.await(5, TimeUnit.SECONDS)).isTrue();

            registry.removeInstance(SERVICE, B);
            pending.complete(new UpstreamResponse(200, Map.of(), "b".getBytes()));

            assertThat(toB.get(5, TimeUnit.SECONDS).body()).isEqualTo("b".getBytes());
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < 10; i++) {
            router.route(SERVICE, REQUEST);
        }
        verify(transport, times(11)).send(eq(A), any(), any());
        verify(transport, times(1)).send(eq(B), any(), any());
    }
}
