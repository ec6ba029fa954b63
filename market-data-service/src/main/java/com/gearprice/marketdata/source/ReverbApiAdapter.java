package com.gearprice.marketdata.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gearprice.common.model.Listing;
import com.gearprice.common.model.ListingCondition;
import com.gearprice.marketdata.gate.RequestGate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * Reverb listings API ({@code GET /api/listings?query=..}).
 *
 * <p>Response shape used:
 * <pre>
 *   { "listings": [ { "title": "...",
 *                     "price": { "amount": "1299.00", "currency": "USD" },
 *                     "condition": { "display_name": "Excellent" },
 *                     "_links": { "web": { "href": "https://reverb.com/item/..." } } } ] }
 * </pre>
 */
public class ReverbApiAdapter extends StructuredApiAdapter {

    public static final String FAMILY = "Reverb";

    static final String PRODUCTION_URL = "https://api.reverb.com";
    static final String SANDBOX_URL    = "https://sandbox.reverb.com";

    private static final int PER_PAGE = 50;

    private final String baseUrl;

    public ReverbApiAdapter(RequestGate gate, ObjectMapper objectMapper, String apiToken,
                            boolean useSandbox, Clock clock) {
        super(FAMILY, gate, objectMapper, apiToken, clock);
        this.baseUrl = useSandbox ? SANDBOX_URL : PRODUCTION_URL;
    }

    @Override
    protected URI searchUri(String query) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .path("/api/listings")
            .queryParam("query", "{query}")
            .queryParam("per_page", PER_PAGE)
            .encode()
            .buildAndExpand(query)
            .toUri();
    }

    @Override
    protected Map<String, String> extraHeaders() {
        return Map.of("Accept-Version", "3.0", "Content-Type", "application/hal+json");
    }

    @Override
    protected JsonNode resultItems(JsonNode root) {
        return root.path("listings");
    }

    @Override
    protected Listing toListing(JsonNode item) {
        Double price = priceOf(item.path("price").path("amount"));
        if (price == null) {
            return null;
        }
        return new Listing(
            item.path("title").asText(""),
            price,
            ListingCondition.fromText(item.path("condition").path("display_name").asText(null)),
            item.path("_links").path("web").path("href").asText(null));
    }
}
