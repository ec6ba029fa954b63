package com.gearprice.marketdata.gate;

import com.gearprice.marketdata.support.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestGateTest {

    private static final URI URL = URI.create("https://www.ebay.com/sch/i.html?_nkw=strat");

    private static GateSettings fast(int maxRetries) {
        return new GateSettings(Duration.ZERO, 100, Duration.ZERO, maxRetries,
            Duration.ofMillis(5), Duration.ofMillis(1), Duration.ofSeconds(2));
    }

    private static RequestGate gate(StubExchange stub, GateSettings settings) {
        return new RequestGate(stub.webClient(), settings, Clock.systemUTC(), new Random(7));
    }

    // ── pacing ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("pacing")
    class Pacing {

        private final Clock fixed = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

        @Test
        @DisplayName("30 requests at a 2s interval reserve slots spanning 58s")
        void thirtyRequestsSpan58Seconds() {
            GateSettings settings = new GateSettings(Duration.ofSeconds(2), 100, Duration.ofSeconds(30), 3,
                Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(15));
            RequestGate gate = new RequestGate(StubExchange.alwaysOk("").webClient(), settings, fixed, new Random(1));

            Duration last = Duration.ZERO;
            for (int i = 0; i < 30; i++) {
                last = gate.reserveSlot();
            }
            assertEquals(Duration.ofSeconds(58), last);
        }

        @Test
        @DisplayName("a full session adds the session rest before the next slot")
        void sessionRest() {
            GateSettings settings = new GateSettings(Duration.ofSeconds(2), 20, Duration.ofSeconds(30), 3,
                Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(15));
            RequestGate gate = new RequestGate(StubExchange.alwaysOk("").webClient(), settings, fixed, new Random(1));

            Duration slot20 = Duration.ZERO;
            for (int i = 0; i < 20; i++) {
                slot20 = gate.reserveSlot();
            }
            Duration slot21 = gate.reserveSlot();

            assertEquals(Duration.ofSeconds(38), slot20);
            assertEquals(Duration.ofSeconds(70), slot21);
        }

        @Test
        @DisplayName("concurrent executions are spaced by the minimum interval in real time")
        void realInterval() {
            GateSettings settings = new GateSettings(Duration.ofMillis(100), 100, Duration.ZERO, 0,
                Duration.ZERO, Duration.ZERO, Duration.ofSeconds(2));
            StubExchange stub = StubExchange.alwaysOk("ok");
            RequestGate gate = gate(stub, settings);

            long start = System.nanoTime();
            Flux.range(0, 5)
                .flatMap(i -> gate.execute(URL, Map.of()))
                .blockLast(Duration.ofSeconds(10));
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(5, stub.count());
            assertTrue(elapsedMs >= 400, "elapsed " + elapsedMs + "ms");
        }
    }

    // ── retries ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("429 twice then 200 → success on the third attempt")
        void rateLimitedThenOk() {
            AtomicInteger calls = new AtomicInteger();
            StubExchange stub = StubExchange.responding(req -> Mono.just(
                calls.incrementAndGet() <= 2
                    ? StubExchange.response(HttpStatus.TOO_MANY_REQUESTS, "slow down")
                    : StubExchange.ok("<html>ok</html>")));

            StepVerifier.create(gate(stub, fast(3)).execute(URL, Map.of()))
                .assertNext(r -> {
                    assertTrue(r.isSuccess());
                    assertEquals("<html>ok</html>", r.body());
                })
                .verifyComplete();
            assertEquals(3, stub.count());
        }

        @Test
        @DisplayName("persistent 500 → last response after maxRetries retries")
        void givesUp() {
            StubExchange stub = StubExchange.responding(req ->
                Mono.just(StubExchange.response(HttpStatus.INTERNAL_SERVER_ERROR, "")));

            StepVerifier.create(gate(stub, fast(2)).execute(URL, Map.of()))
                .assertNext(r -> {
                    assertFalse(r.isSuccess());
                    assertEquals(500, r.status());
                })
                .verifyComplete();
            assertEquals(3, stub.count());
        }

        @Test
        @DisplayName("transport error becomes a failure response, never an error signal")
        void transportError() {
            StubExchange stub = StubExchange.responding(req -> Mono.error(new IllegalStateException("connection reset")));

            StepVerifier.create(gate(stub, fast(1)).execute(URL, Map.of()))
                .assertNext(r -> {
                    assertEquals(GateResponse.NO_STATUS, r.status());
                    assertTrue(r.describe().contains("connection reset"));
                })
                .verifyComplete();
            assertEquals(2, stub.count());
        }

        @Test
        @DisplayName("slow response times out and is reported as a failure")
        void timeout() {
            GateSettings settings = new GateSettings(Duration.ZERO, 100, Duration.ZERO, 0,
                Duration.ZERO, Duration.ZERO, Duration.ofMillis(50));
            StubExchange stub = StubExchange.responding(req ->
                Mono.delay(Duration.ofSeconds(5)).thenReturn(StubExchange.ok("late")));

            StepVerifier.create(gate(stub, settings).execute(URL, Map.of()))
                .assertNext(r -> assertEquals("timeout", r.failureReason()))
                .verifyComplete();
        }

        @Test
        @DisplayName("backoff grows linearly with the attempt number")
        void backoff() {
            RequestGate gate = gate(StubExchange.alwaysOk(""), new GateSettings(Duration.ZERO, 100, Duration.ZERO, 3,
                Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(15)));

            assertEquals(Duration.ofSeconds(10), gate.backoff(GateResponse.of(429, ""), 1));
            assertEquals(Duration.ofSeconds(3), gate.backoff(GateResponse.of(503, ""), 2));
            assertEquals(Duration.ofSeconds(1), gate.backoff(GateResponse.failure("timeout"), 0));
        }
    }

    // ── headers ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("browser headers are added and caller headers win")
    void headers() {
        StubExchange stub = StubExchange.alwaysOk("{}");

        gate(stub, fast(0)).execute(URL, Map.of(HttpHeaders.ACCEPT, "application/json")).block(Duration.ofSeconds(5));

        ClientRequest request = stub.requests().get(0);
        assertTrue(RequestGate.USER_AGENTS.contains(request.headers().getFirst(HttpHeaders.USER_AGENT)));
        assertEquals("en-US,en;q=0.9", request.headers().getFirst(HttpHeaders.ACCEPT_LANGUAGE));
        assertEquals("application/json", request.headers().getFirst(HttpHeaders.ACCEPT));
        assertEquals(URL, request.url());
    }
}
