package com.gearprice.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gearprice.common.stats.PriceStatistics;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One source adapter's answer for a query. Immutable once created.
 *
 * <p>{@code price} is always positive. For listing-backed observations it is the
 * listing average and the distribution fields are populated; simulated
 * observations carry only a price and a {@code confidenceHint}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Observation(
    String sourceFamily,
    SourceKind sourceKind,
    double price,
    Double medianPrice,
    Double minPrice,
    Double maxPrice,
    int count,
    Map<String, Integer> conditionCounts,
    List<Listing> sampleListings,
    Double confidenceHint,
    Instant capturedAt
) {

    public static final int MAX_SAMPLE_LISTINGS = 5;

    public Observation {
        if (!(price > 0.0)) {
            throw new IllegalArgumentException("Observation price must be positive: " + price);
        }
        conditionCounts = conditionCounts == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conditionCounts));
        sampleListings  = sampleListings == null ? List.of() : List.copyOf(sampleListings);
    }

    /**
     * Builds a distribution observation from parsed listings.
     *
     * @param listings non-empty list of listings with positive prices
     */
    public static Observation fromListings(String family, SourceKind kind,
                                           List<Listing> listings, Instant capturedAt) {
        PriceStatistics stats = PriceStatistics.ofListings(listings);
        return new Observation(family, kind,
            stats.average(), stats.median(), stats.min(), stats.max(), stats.count(),
            stats.conditionCounts(),
            listings.subList(0, Math.min(MAX_SAMPLE_LISTINGS, listings.size())),
            null, capturedAt);
    }

    public static Observation simulated(String family, double price,
                                        double confidenceHint, Instant capturedAt) {
        return new Observation(family, SourceKind.SIMULATED, price,
            null, null, null, 0, Map.of(), List.of(), confidenceHint, capturedAt);
    }

    /** {@code <family>_<kind tag>}, e.g. {@code reverb_api} or {@code ebay_scraped}. */
    public String sourceType() {
        return sourceFamily.toLowerCase(Locale.ROOT) + "_" + sourceKind.tag();
    }

    public boolean hasDistribution() {
        return medianPrice != null && minPrice != null && maxPrice != null;
    }
}
