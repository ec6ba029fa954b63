package com.gearprice.marketdata.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gearprice.common.exception.PriceSourceException;
import com.gearprice.common.model.Listing;
import com.gearprice.common.model.Observation;
import com.gearprice.common.model.SourceKind;
import com.gearprice.marketdata.gate.GateResponse;
import com.gearprice.marketdata.gate.RequestGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Base for documented price-listing endpoints called with a bearer token.
 *
 * <p>Completes empty without any network call when no token is configured, and
 * empty on a non-success response or when no listing has a usable price.
 * Individual malformed listings are skipped. An unparseable body raises
 * {@link PriceSourceException} internally and is reported as empty.
 */
public abstract class StructuredApiAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(StructuredApiAdapter.class);

    private final String family;
    private final RequestGate gate;
    private final ObjectMapper objectMapper;
    private final String apiToken;
    private final Clock clock;

    protected StructuredApiAdapter(String family, RequestGate gate, ObjectMapper objectMapper,
                                   String apiToken, Clock clock) {
        this.family       = family;
        this.gate         = gate;
        this.objectMapper = objectMapper;
        this.apiToken     = apiToken;
        this.clock        = clock;
    }

    @Override
    public String family() {
        return family;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.API;
    }

    public boolean isConfigured() {
        return apiToken != null && !apiToken.isBlank();
    }

    @Override
    public Mono<Observation> fetch(String query) {
        if (!isConfigured()) {
            log.debug("API_SKIPPED source={} reason=no-credentials", name());
            return Mono.empty();
        }
        Map<String, String> headers = new LinkedHashMap<>(extraHeaders());
        headers.put("Authorization", "Bearer " + apiToken);
        headers.put("Accept", "application/json");

        return gate.execute(searchUri(query), headers)
            .flatMap(response -> toObservation(query, response))
            .onErrorResume(PriceSourceException.class, e -> {
                log.warn("API_BAD_RESPONSE source={} query={} reason={}", name(), query, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Observation> toObservation(String query, GateResponse response) {
        if (!response.isSuccess()) {
            log.warn("API_UNAVAILABLE source={} query={} outcome={}", name(), query, response.describe());
            return Mono.empty();
        }
        List<Listing> listings = new ArrayList<>();
        for (JsonNode item : resultItems(readTree(response.body()))) {
            Listing listing = toListing(item);
            if (listing != null) {
                listings.add(listing);
            } else {
                log.debug("API_LISTING_SKIPPED source={} item={}", name(), item);
            }
        }
        if (listings.isEmpty()) {
            log.info("API_NO_RESULTS source={} query={}", name(), query);
            return Mono.empty();
        }
        log.info("API_RESULTS source={} query={} listings={}", name(), query, listings.size());
        return Mono.just(Observation.fromListings(family, SourceKind.API, listings, clock.instant()));
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PriceSourceException(family, "Unparseable API response", e);
        }
    }

    /** Absolute search URI for the normalized query. */
    protected abstract URI searchUri(String query);

    /** Source-specific headers in addition to authorization. */
    protected abstract Map<String, String> extraHeaders();

    /** The array of result items inside the response; an empty node when missing. */
    protected abstract JsonNode resultItems(JsonNode root);

    /** Maps one result item, or returns {@code null} when it has no usable price. */
    protected abstract Listing toListing(JsonNode item);

    /** Reads a price that may arrive as a JSON number or as text. */
    protected static Double priceOf(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return value > 0.0 ? value : null;
        }
        OptionalDouble parsed = PriceTextParser.parse(node.asText());
        return parsed.isPresent() ? parsed.getAsDouble() : null;
    }
}
