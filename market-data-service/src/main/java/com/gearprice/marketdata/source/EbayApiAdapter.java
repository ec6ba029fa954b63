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
 * eBay Browse API item summary search
 * ({@code GET /buy/browse/v1/item_summary/search?q=..}).
 *
 * <p>Response shape used:
 * <pre>
 *   { "itemSummaries": [ { "title": "...",
 *                          "price": { "value": "799.99", "currency": "USD" },
 *                          "condition": "Used",
 *                          "itemWebUrl": "https://www.ebay.com/itm/..." } ] }
 * </pre>
 */
public class EbayApiAdapter extends StructuredApiAdapter {

    public static final String FAMILY = "eBay";

    static final String PRODUCTION_URL = "https://api.ebay.com";
    static final String SANDBOX_URL    = "https://api.sandbox.ebay.com";

    private static final int LIMIT = 50;

    private final String baseUrl;

    public EbayApiAdapter(RequestGate gate, ObjectMapper objectMapper, String apiToken,
                          boolean useSandbox, Clock clock) {
        super(FAMILY, gate, objectMapper, apiToken, clock);
        this.baseUrl = useSandbox ? SANDBOX_URL : PRODUCTION_URL;
    }

    @Override
    protected URI searchUri(String query) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .path("/buy/browse/v1/item_summary/search")
            .queryParam("q", "{query}")
            .queryParam("limit", LIMIT)
            .encode()
            .buildAndExpand(query)
            .toUri();
    }

    @Override
    protected Map<String, String> extraHeaders() {
        return Map.of("X-EBAY-C-MARKETPLACE-ID", "EBAY_US");
    }

    @Override
    protected JsonNode resultItems(JsonNode root) {
        return root.path("itemSummaries");
    }

    @Override
    protected Listing toListing(JsonNode item) {
        Double price = priceOf(item.path("price").path("value"));
        if (price == null) {
            return null;
        }
        return new Listing(
            item.path("title").asText(""),
            price,
            ListingCondition.fromText(item.path("condition").asText(null)),
            item.path("itemWebUrl").asText(null));
    }
}
