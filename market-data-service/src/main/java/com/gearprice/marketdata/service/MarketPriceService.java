package com.gearprice.marketdata.service;

import com.gearprice.common.classifier.InstrumentCategoryClassifier;
import com.gearprice.common.consensus.ConsensusEngine;
import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.query.QueryNormalizer;
import com.gearprice.marketdata.cache.CacheEntry;
import com.gearprice.marketdata.cache.JsonFileCacheStore;
import com.gearprice.marketdata.model.PricedItem;
import com.gearprice.marketdata.orchestrator.FallbackOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

/**
 * Market price lookup backed by the durable consensus cache.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Normalize the description; the normalized query is the cache key.</li>
 *   <li>Check the consensus cache for a fresh entry (skipped on {@code forceRefresh}).</li>
 *   <li>On hit → return the stored result, no source is contacted.</li>
 *   <li>On miss → collect per-family observations through the
 *       {@link FallbackOrchestrator}, fuse them, store the result and return it.
 *       {@code no_data} results are returned but never stored.</li>
 * </ol>
 *
 * <p>Cache file writes run on the bounded-elastic scheduler.
 */
public class MarketPriceService {

    private static final Logger log = LoggerFactory.getLogger(MarketPriceService.class);

    private final FallbackOrchestrator orchestrator;
    private final ConsensusEngine consensusEngine;
    private final JsonFileCacheStore<ConsensusResult> consensusCache;
    private final Clock clock;
    private final int workerPoolSize;

    public MarketPriceService(FallbackOrchestrator orchestrator,
                              ConsensusEngine consensusEngine,
                              JsonFileCacheStore<ConsensusResult> consensusCache,
                              Clock clock,
                              int workerPoolSize) {
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be at least 1: " + workerPoolSize);
        }
        this.orchestrator    = orchestrator;
        this.consensusEngine = consensusEngine;
        this.consensusCache  = consensusCache;
        this.clock           = clock;
        this.workerPoolSize  = workerPoolSize;
    }

    public Mono<ConsensusResult> getMarketPrice(String description) {
        return getMarketPrice(description, false);
    }

    /**
     * @param description  raw item description, e.g. an auction lot title
     * @param forceRefresh bypass the cache read; the fresh result still overwrites it
     * @return the consensus result; errors only with {@link IllegalArgumentException}
     *         for a blank description
     */
    public Mono<ConsensusResult> getMarketPrice(String description, boolean forceRefresh) {
        return Mono.defer(() -> {
            String query = QueryNormalizer.normalize(description);

            if (!forceRefresh) {
                CacheEntry<ConsensusResult> cached = consensusCache.get(query);
                if (cached != null) {
                    log.info("CACHE_HIT key={} sourceType={} capturedAt={}",
                             query, cached.payload().sourceType(), cached.capturedAt());
                    return Mono.just(cached.payload());
                }
            }

            log.info("CACHE_MISS key={} forceRefresh={}", query, forceRefresh);
            return orchestrator.collect(query)
                .map(observations -> consensusEngine.fuse(query, observations, clock.instant()))
                .flatMap(result -> store(query, result));
        });
    }

    /**
     * Prices a batch with at most {@code workerPoolSize} items in flight. Results are
     * emitted in input order. A failing item yields a {@code no_data} result instead of
     * failing the batch.
     */
    public Flux<PricedItem> getMarketPrices(List<String> descriptions) {
        return Flux.fromIterable(descriptions)
            .flatMapSequential(description -> getMarketPrice(description)
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(result -> new PricedItem(description, result))
                    .onErrorResume(e -> {
                        log.warn("BATCH_ITEM_FAILED description={} reason={}", description, e.getMessage());
                        return Mono.just(new PricedItem(description, noDataFor(description)));
                    }),
                workerPoolSize);
    }

    /** Drops the cached consensus for the description's normalized query. */
    public Mono<Boolean> invalidate(String description) {
        return Mono.fromCallable(() -> consensusCache.invalidate(QueryNormalizer.normalize(description)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<ConsensusResult> store(String query, ConsensusResult result) {
        if (!result.hasData()) {
            log.warn("NO_DATA key={} action=NOT_CACHED", query);
            return Mono.just(result);
        }
        log.info("CONSENSUS key={} averagePrice={} confidence={} sourceType={} sources={}",
                 query, result.averagePrice(), result.confidenceLevel(), result.sourceType(), result.sources().keySet());
        return Mono.fromCallable(() -> consensusCache.put(query, result))
            .subscribeOn(Schedulers.boundedElastic())
            .thenReturn(result);
    }

    private ConsensusResult noDataFor(String description) {
        String text = description == null ? "" : description;
        return ConsensusResult.noData(text, InstrumentCategoryClassifier.classify(text), clock.instant());
    }
}
