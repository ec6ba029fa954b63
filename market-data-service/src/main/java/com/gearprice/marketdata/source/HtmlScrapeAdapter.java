package com.gearprice.marketdata.source;

import com.gearprice.common.model.Listing;
import com.gearprice.common.model.Observation;
import com.gearprice.common.model.SourceKind;
import com.gearprice.marketdata.cache.CacheEntry;
import com.gearprice.marketdata.cache.JsonFileCacheStore;
import com.gearprice.marketdata.gate.RequestGate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for sold/completed-listing search page scrapers.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check the scrape cache namespace ({@code <family>:<query>}); a fresh entry
 *       is returned without touching the network.</li>
 *   <li>Request pages 1..{@code maxPages} through the shared {@link RequestGate}.
 *       Stop early once {@code targetResults} listings are collected or a page
 *       comes back short, which marks the end of the results.</li>
 *   <li>Parse each listing; rows without a readable price are skipped.</li>
 *   <li>Zero listings → empty. Otherwise build the observation and cache it.</li>
 * </ol>
 *
 * <p>A failed page ends pagination; listings gathered from earlier pages are kept.
 */
public abstract class HtmlScrapeAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(HtmlScrapeAdapter.class);

    private final String family;
    private final RequestGate gate;
    private final JsonFileCacheStore<Observation> scrapeCache;
    private final ScrapeSettings settings;
    private final Clock clock;

    protected HtmlScrapeAdapter(String family, RequestGate gate, JsonFileCacheStore<Observation> scrapeCache,
                                ScrapeSettings settings, Clock clock) {
        this.family      = family;
        this.gate        = gate;
        this.scrapeCache = scrapeCache;
        this.settings    = settings;
        this.clock       = clock;
    }

    @Override
    public String family() {
        return family;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SCRAPED;
    }

    @Override
    public Mono<Observation> fetch(String query) {
        String cacheKey = cacheKey(query);
        CacheEntry<Observation> cached = scrapeCache.get(cacheKey);
        if (cached != null) {
            log.info("SCRAPE_CACHE_HIT source={} key={} capturedAt={}", name(), cacheKey, cached.capturedAt());
            return Mono.just(cached.payload());
        }

        return collectPages(query, 1, new ArrayList<>())
            .flatMap(listings -> {
                if (listings.isEmpty()) {
                    log.info("SCRAPE_NO_RESULTS source={} query={}", name(), query);
                    return Mono.empty();
                }
                Observation observation = Observation.fromListings(family, SourceKind.SCRAPED, listings, clock.instant());
                log.info("SCRAPE_RESULTS source={} query={} listings={} median={}",
                         name(), query, observation.count(), observation.medianPrice());
                return Mono.fromCallable(() -> scrapeCache.put(cacheKey, observation))
                    .subscribeOn(Schedulers.boundedElastic())
                    .thenReturn(observation);
            });
    }

    String cacheKey(String query) {
        return family.toLowerCase(Locale.ROOT) + ":" + query;
    }

    private Mono<List<Listing>> collectPages(String query, int page, List<Listing> collected) {
        return gate.execute(searchUri(query, page), Map.of())
            .flatMap(response -> {
                if (!response.isSuccess()) {
                    log.warn("SCRAPE_PAGE_FAILED source={} query={} page={} outcome={}",
                             name(), query, page, response.describe());
                    return Mono.just(collected);
                }
                List<Listing> pageListings = parsePage(Jsoup.parse(response.body(), baseUri()));
                collected.addAll(pageListings);
                log.debug("SCRAPE_PAGE source={} query={} page={} listings={} total={}",
                          name(), query, page, pageListings.size(), collected.size());

                boolean lastPage = page >= settings.maxPages()
                    || collected.size() >= settings.targetResults()
                    || pageListings.size() < settings.shortPageThreshold();
                return lastPage ? Mono.just(collected) : collectPages(query, page + 1, collected);
            });
    }

    List<Listing> parsePage(Document document) {
        List<Listing> listings = new ArrayList<>();
        for (Element item : document.select(itemSelector())) {
            try {
                Listing listing = toListing(item);
                if (listing != null) {
                    listings.add(listing);
                }
            } catch (RuntimeException e) {
                log.debug("SCRAPE_LISTING_SKIPPED source={} reason={}", name(), e.getMessage());
            }
        }
        return listings;
    }

    /** Absolute URI of one page of sold results, pages starting at 1. */
    protected abstract URI searchUri(String query, int page);

    /** Base URI for resolving relative links. */
    protected abstract String baseUri();

    /** CSS selector matching one listing row. */
    protected abstract String itemSelector();

    /** Maps one listing row, or returns {@code null} when it is not a real listing or has no price. */
    protected abstract Listing toListing(Element item);

    protected ScrapeSettings settings() {
        return settings;
    }

    /** Text of the first element matching {@code selector}, or {@code null}. */
    protected static String textOf(Element item, String selector) {
        Element el = item.selectFirst(selector);
        return el != null ? el.text().trim() : null;
    }
}
