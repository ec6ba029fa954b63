package com.gearprice.marketdata.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gearprice.common.model.ListingCondition;
import com.gearprice.common.model.Observation;
import com.gearprice.marketdata.cache.JsonFileCacheStore;
import com.gearprice.marketdata.gate.GateSettings;
import com.gearprice.marketdata.gate.RequestGate;
import com.gearprice.marketdata.support.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ReverbScrapeAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static final String PAGE = """
        <html><body><div class="rc-listing-grid">
          <div class="rc-listing-card">
            <a class="rc-listing-card__title-link" href="/item/101-gibson-les-paul-studio">Gibson Les Paul Studio</a>
            <div class="rc-listing-card__condition">Excellent</div>
            <div class="rc-price-block"><span class="rc-price-block__price">$1,400</span></div>
          </div>
          <div class="rc-listing-card">
            <a class="rc-listing-card__title-link" href="/item/102-gibson-les-paul-tribute">Gibson Les Paul Tribute</a>
            <div class="rc-listing-card__condition">Good</div>
            <div class="rc-price-block"><span class="rc-price-block__price">$1,000</span></div>
          </div>
          <div class="rc-listing-card">
            <a class="rc-listing-card__title-link" href="/item/103">Gibson Les Paul (price hidden)</a>
            <div class="rc-price-block"><span class="rc-price-block__price">Make an offer</span></div>
          </div>
        </div></body></html>
        """;

    @TempDir
    Path dir;

    private ReverbScrapeAdapter adapter(StubExchange stub) {
        RequestGate gate = new RequestGate(stub.webClient(),
            new GateSettings(Duration.ZERO, 1000, Duration.ZERO, 0, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(2)),
            CLOCK, new Random(9));
        JsonFileCacheStore<Observation> cache = new JsonFileCacheStore<>("scrape", dir.resolve("scrape_cache.json"),
            Duration.ofHours(24), Observation.class, new ObjectMapper().registerModule(new JavaTimeModule()), CLOCK);
        return new ReverbScrapeAdapter(gate, cache, new ScrapeSettings(3, 60, 100), CLOCK);
    }

    @Test
    @DisplayName("listing cards are parsed; cards without a price are skipped")
    void parsesCards() {
        StubExchange stub = StubExchange.alwaysOk(PAGE);

        StepVerifier.create(adapter(stub).fetch("gibson les paul"))
            .assertNext(obs -> {
                assertEquals("reverb_scraped", obs.sourceType());
                assertEquals(2, obs.count());
                assertEquals(1200.0, obs.price(), 1e-9);
                assertEquals(ListingCondition.LIKE_NEW, obs.sampleListings().get(0).condition());
                assertEquals("https://reverb.com/item/101-gibson-les-paul-studio", obs.sampleListings().get(0).url());
            })
            .verifyComplete();
        // Two cards on a 60-result page is a short page: no second request.
        assertEquals(1, stub.count());
    }

    @Test
    @DisplayName("search is restricted to sold listings")
    void soldOnly() {
        URI uri = adapter(StubExchange.alwaysOk("")).searchUri("gibson les paul", 1);

        assertEquals("reverb.com", uri.getHost());
        assertEquals("/marketplace", uri.getPath());
        assertTrue(uri.getRawQuery().contains("show_only_sold=true"));
        assertTrue(uri.getRawQuery().contains("query=gibson%20les%20paul"));
        assertTrue(uri.getRawQuery().contains("page=1"));
    }
}
