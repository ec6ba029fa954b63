package com.gearprice.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fused market price for one normalized query. Persisted in the consensus cache
 * namespace and returned to callers.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code averagePrice}: mean of the observation prices folded in; 0 when no data</li>
 *   <li>{@code medianPrice}, {@code minPrice}, {@code maxPrice}: optional distribution</li>
 *   <li>{@code confidenceLevel}: trust in {@code averagePrice}, 0–100</li>
 *   <li>{@code sources}: source type → price actually used</li>
 *   <li>{@code sourceType}: primary family and kind, or {@value #NO_DATA}</li>
 *   <li>{@code count}: number of observations folded in</li>
 *   <li>{@code listingCount}: marketplace listings behind those observations</li>
 *   <li>{@code conditionCounts}: condition label → listing count of the primary observation</li>
 * </ul>
 *
 * <p>Pure data: no reactive types and no Spring dependencies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsensusResult(
    String query,
    double averagePrice,
    Double medianPrice,
    Double minPrice,
    Double maxPrice,
    double confidenceLevel,
    Map<String, Double> sources,
    String sourceType,
    int count,
    int listingCount,
    Map<String, Integer> conditionCounts,
    PriceVolatility volatility,
    InstrumentCategory category,
    Instant capturedAt
) {

    public static final String NO_DATA = "no_data";

    public ConsensusResult {
        sources = sources == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        conditionCounts = conditionCounts == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conditionCounts));
    }

    public static ConsensusResult noData(String query, InstrumentCategory category, Instant capturedAt) {
        return new ConsensusResult(query, 0.0, null, null, null, 0.0, Map.of(),
            NO_DATA, 0, 0, Map.of(), PriceVolatility.UNKNOWN, category, capturedAt);
    }

    public boolean hasData() {
        return !NO_DATA.equals(sourceType) && averagePrice > 0.0;
    }
}
