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
 * Reverb marketplace search restricted to sold listings ({@code /marketplace?show_only_sold=true}).
 */
public class ReverbScrapeAdapter extends HtmlScrapeAdapter {

    static final String BASE_URL = "https://reverb.com";

    public ReverbScrapeAdapter(RequestGate gate, JsonFileCacheStore<Observation> scrapeCache,
                               ScrapeSettings settings, Clock clock) {
        super(ReverbApiAdapter.FAMILY, gate, scrapeCache, settings, clock);
    }

    @Override
    protected URI searchUri(String query, int page) {
        return UriComponentsBuilder.fromUriString(BASE_URL)
            .path("/marketplace")
            .queryParam("query", "{query}")
            .queryParam("show_only_sold", true)
            .queryParam("per_page", settings().pageSize())
            .queryParam("page", page)
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
        return ".rc-listing-card";
    }

    @Override
    protected Listing toListing(Element item) {
        OptionalDouble price = PriceTextParser.parse(textOf(item, ".rc-price-block__price"));
        if (price.isEmpty()) {
            return null;
        }
        Element link = item.selectFirst("a.rc-listing-card__title-link");
        String title = link != null ? link.text().trim() : textOf(item, ".rc-listing-card__title");
        return new Listing(
            title != null ? title : "",
            price.getAsDouble(),
            ListingCondition.fromText(textOf(item, ".rc-listing-card__condition")),
            link != null ? link.absUrl("href") : null);
    }
}
