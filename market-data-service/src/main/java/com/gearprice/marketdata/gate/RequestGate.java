package com.gearprice.marketdata.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single serialization point for every outbound request made by the network
 * source adapters.
 *
 * <p><strong>Pacing:</strong> each attempt reserves the next free send slot
 * {@code max(now, lastRequestTime + minRequestInterval)} under a lock and waits
 * for it with {@code Mono.delay}, so concurrent callers queue up behind each other
 * instead of bypassing the interval. Every {@code maxRequestsPerSession} slots the
 * gate adds a {@code sessionRest} pause and starts a new session.
 *
 * <p><strong>Retries:</strong> a 429 waits {@code rateLimitBackoff × (attempt + 1)},
 * any other non-2xx status, timeout or transport error waits
 * {@code errorBackoff × (attempt + 1)}. After {@code maxRetries} retries the last
 * response (or a failure) is returned. The returned {@link Mono} never errors.
 *
 * <p>One instance is shared by all adapters in the process.
 */
public class RequestGate {

    private static final Logger log = LoggerFactory.getLogger(RequestGate.class);

    static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8";

    private final WebClient webClient;
    private final GateSettings settings;
    private final Clock clock;
    private final Random random;

    private final ReentrantLock lock = new ReentrantLock();
    private Instant lastRequestTime = Instant.EPOCH;
    private int sessionRequests;

    public RequestGate(WebClient webClient, GateSettings settings, Clock clock, Random random) {
        this.webClient = webClient;
        this.settings  = settings;
        this.clock     = clock;
        this.random    = random;
    }

    /**
     * Executes a paced GET with bounded retries.
     *
     * @param uri     absolute request URI
     * @param headers caller headers; they override the gate's browser defaults
     * @return the final response or a failure response; never an error signal
     */
    public Mono<GateResponse> execute(URI uri, Map<String, String> headers) {
        return attempt(uri, headers, 0);
    }

    private Mono<GateResponse> attempt(URI uri, Map<String, String> headers, int attempt) {
        return Mono.defer(() -> Mono.delay(reserveSlot()).then(send(uri, headers)))
            .onErrorResume(e -> Mono.just(GateResponse.failure(describe(e))))
            .flatMap(response -> {
                if (response.isSuccess()) {
                    return Mono.just(response);
                }
                if (attempt >= settings.maxRetries()) {
                    log.warn("GATE_GAVE_UP host={} attempts={} lastOutcome={}",
                             uri.getHost(), attempt + 1, response.describe());
                    return Mono.just(response);
                }
                Duration backoff = backoff(response, attempt);
                log.warn("GATE_RETRY host={} attempt={} outcome={} backoffMs={}",
                         uri.getHost(), attempt + 1, response.describe(), backoff.toMillis());
                return Mono.delay(backoff).then(attempt(uri, headers, attempt + 1));
            });
    }

    private Mono<GateResponse> send(URI uri, Map<String, String> headers) {
        String userAgent = nextUserAgent();
        log.debug("GATE_REQUEST url={}", uri);
        return webClient.get()
            .uri(uri)
            .headers(h -> {
                h.set(HttpHeaders.USER_AGENT, userAgent);
                h.set(HttpHeaders.ACCEPT_LANGUAGE, ACCEPT_LANGUAGE);
                h.set(HttpHeaders.ACCEPT, ACCEPT);
                headers.forEach(h::set);
            })
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> GateResponse.of(response.statusCode().value(), body)))
            .timeout(settings.requestTimeout());
    }

    // ── pacing ────────────────────────────────────────────────────────────────

    /**
     * Reserves the next send slot and returns how long the caller must wait for it.
     */
    Duration reserveSlot() {
        lock.lock();
        try {
            Instant now  = clock.instant();
            Instant slot = lastRequestTime.plus(settings.minRequestInterval());
            if (slot.isBefore(now)) {
                slot = now;
            }
            if (settings.maxRequestsPerSession() > 0 && sessionRequests >= settings.maxRequestsPerSession()) {
                log.info("GATE_SESSION_REST requests={} restSeconds={}",
                         sessionRequests, settings.sessionRest().toSeconds());
                slot = slot.plus(settings.sessionRest());
                sessionRequests = 0;
            }
            sessionRequests++;
            lastRequestTime = slot;
            return Duration.between(now, slot);
        } finally {
            lock.unlock();
        }
    }

    Duration backoff(GateResponse response, int attempt) {
        Duration base = response.isRateLimited() ? settings.rateLimitBackoff() : settings.errorBackoff();
        return base.multipliedBy(attempt + 1L);
    }

    private String nextUserAgent() {
        lock.lock();
        try {
            return USER_AGENTS.get(random.nextInt(USER_AGENTS.size()));
        } finally {
            lock.unlock();
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
