package com.gearprice.marketdata.gate;

import java.time.Duration;

/**
 * Pacing and retry policy of a {@link RequestGate}.
 *
 * @param minRequestInterval    minimum spacing between two outbound requests
 * @param maxRequestsPerSession requests after which the gate rests; 0 disables resting
 * @param sessionRest           pause inserted once a session budget is spent
 * @param maxRetries            retries after the first attempt
 * @param rateLimitBackoff      base wait after a 429, multiplied by (attempt + 1)
 * @param errorBackoff          base wait after any other failure, multiplied by (attempt + 1)
 * @param requestTimeout        per-attempt response timeout
 */
public record GateSettings(
    Duration minRequestInterval,
    int maxRequestsPerSession,
    Duration sessionRest,
    int maxRetries,
    Duration rateLimitBackoff,
    Duration errorBackoff,
    Duration requestTimeout
) {

    public static GateSettings defaults() {
        return new GateSettings(
            Duration.ofSeconds(2), 20, Duration.ofSeconds(30),
            3, Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(15));
    }
}
