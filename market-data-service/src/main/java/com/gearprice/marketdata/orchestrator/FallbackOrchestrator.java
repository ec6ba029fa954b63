package com.gearprice.marketdata.orchestrator;

import com.gearprice.common.model.Observation;
import com.gearprice.marketdata.source.PriceSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Collects at most one observation per source family.
 *
 * <p>Within a family the adapters are tried strictly in priority order and the
 * first non-empty answer wins; later adapters are never subscribed. An adapter
 * error is logged and treated like an empty answer. Families are visited in
 * configured order, so the returned list order is deterministic.
 */
public class FallbackOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FallbackOrchestrator.class);

    private final List<SourceFamilyChain> chains;

    public FallbackOrchestrator(List<SourceFamilyChain> chains) {
        this.chains = List.copyOf(chains);
    }

    /** Never errors; an item with no answers from any family yields an empty list. */
    public Mono<List<Observation>> collect(String query) {
        return Flux.fromIterable(chains)
            .concatMap(chain -> resolve(chain, query))
            .collectList();
    }

    Mono<Observation> resolve(SourceFamilyChain chain, String query) {
        Mono<Observation> result = Mono.empty();
        for (PriceSourceAdapter adapter : chain.adapters()) {
            result = result.switchIfEmpty(Mono.defer(() -> tryAdapter(adapter, query)));
        }
        return result
            .doOnNext(obs -> log.info("FAMILY_RESOLVED family={} query={} sourceType={} price={}",
                                      chain.family(), query, obs.sourceType(), obs.price()))
            .switchIfEmpty(Mono.<Observation>fromRunnable(() ->
                log.warn("FAMILY_EXHAUSTED family={} query={}", chain.family(), query)));
    }

    private Mono<Observation> tryAdapter(PriceSourceAdapter adapter, String query) {
        Mono<Observation> attempt;
        try {
            attempt = adapter.fetch(query);
        } catch (RuntimeException e) {
            attempt = Mono.error(e);
        }
        return attempt
            .doOnSubscribe(s -> log.debug("SOURCE_ATTEMPT source={} query={}", adapter.name(), query))
            .onErrorResume(e -> {
                log.warn("SOURCE_FAILED source={} query={} reason={}", adapter.name(), query, e.getMessage());
                return Mono.empty();
            });
    }
}
