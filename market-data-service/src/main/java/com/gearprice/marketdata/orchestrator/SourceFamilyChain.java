package com.gearprice.marketdata.orchestrator;

import com.gearprice.marketdata.source.PriceSourceAdapter;

import java.util.Comparator;
import java.util.List;

/**
 * The adapters of one source family, held in priority order (API, scrape, simulated).
 */
public record SourceFamilyChain(String family, List<PriceSourceAdapter> adapters) {

    public SourceFamilyChain {
        if (adapters == null || adapters.isEmpty()) {
            throw new IllegalArgumentException("Family " + family + " has no adapters");
        }
        for (PriceSourceAdapter adapter : adapters) {
            if (!adapter.family().equals(family)) {
                throw new IllegalArgumentException(
                    "Adapter " + adapter.name() + " does not belong to family " + family);
            }
        }
        adapters = adapters.stream()
            .sorted(Comparator.comparing(PriceSourceAdapter::kind))
            .toList();
    }

    public static SourceFamilyChain of(String family, PriceSourceAdapter... adapters) {
        return new SourceFamilyChain(family, List.of(adapters));
    }
}
