package com.gearprice.marketdata.source;

import com.gearprice.common.model.Listing;
import com.gearprice.common.model.ListingCondition;
import com.gearprice.common.model.Observation;
import com.gearprice.marketdata.cache.JsonFileCacheStore;
import com.gearprice.marketdata.gate.RequestGate;
import org.jsoup.nodes.Element;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.OptionalDouble;

/**
 * eBay sold and completed listings search ({@code /sch/i.html?LH_Sold=1&LH_Complete=1}).
 */
public class EbayScrapeAdapter extends HtmlScrapeAdapter {

    static final String BASE_URL = "https://www.ebay.com";

    /** eBay renders a template row with this title ahead of the real results. */
    private static final String PLACEHOLDER_TITLE = "Shop on eBay";

    public EbayScrapeAdapter(RequestGate gate, JsonFileCacheStore<Observation> scrapeCache,
                             ScrapeSettings settings, Clock clock) {
        super(EbayApiAdapter.FAMILY, gate, scrapeCache, settings, clock);
    }

    @Override
    protected URI searchUri(String query, int page) {
        return UriComponentsBuilder.fromUriString(BASE_URL)
            .path("/sch/i.html")
            .queryParam("_nkw", "{query}")
            .queryParam("LH_Sold", 1)
            .queryParam("LH_Complete", 1)
            .queryParam("_ipg", settings().pageSize())
            .queryParam("_pgn", page)
            .encode()
            .buildAndExpand(query)
            .toUri();
    }

    @Override
    protected String baseUri() {
        return BASE_URL;
    }

    @Override
    protected String itemSelector() {
        return "li.s-item";
    }

    @Override
    protected Listing toListing(Element item) {
        String title = textOf(item, ".s-item__title");
        if (title == null || title.isEmpty() || title.equalsIgnoreCase(PLACEHOLDER_TITLE)) {
            return null;
        }
        OptionalDouble price = PriceTextParser.parse(textOf(item, ".s-item__price"));
        if (price.isEmpty()) {
            return null;
        }
        Element link = item.selectFirst("a.s-item__link");
        return new Listing(
            title,
            price.getAsDouble(),
            ListingCondition.fromText(textOf(item, ".SECONDARY_INFO")),
            link != null ? link.absUrl("href") : null);
    }
}
