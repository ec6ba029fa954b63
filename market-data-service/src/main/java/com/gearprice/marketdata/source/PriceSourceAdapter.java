package com.gearprice.marketdata.source;

import com.gearprice.common.model.Observation;
import com.gearprice.common.model.SourceKind;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Strategy interface: one price source of one family (structured API, HTML scrape
 * or simulation).
 *
 * <p>{@link #fetch(String)} completes empty when the source has no usable answer.
 * It may also signal an error; the fallback chain treats both the same way.
 */
public interface PriceSourceAdapter {

    /** Source family, e.g. {@code Reverb} or {@code eBay}. */
    String family();

    SourceKind kind();

    /**
     * @param query normalized item query
     */
    Mono<Observation> fetch(String query);

    default String name() {
        return family().toLowerCase(Locale.ROOT) + "_" + kind().tag();
    }
}
