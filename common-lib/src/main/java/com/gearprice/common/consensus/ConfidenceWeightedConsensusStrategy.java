package com.gearprice.common.consensus;

import com.gearprice.common.classifier.InstrumentCategoryClassifier;
import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.InstrumentCategory;
import com.gearprice.common.model.Observation;
import com.gearprice.common.model.PriceVolatility;
import com.gearprice.common.model.SourceKind;
import com.gearprice.common.stats.PriceStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConsensusEngine}: confidence-weighted fusion with simulated data
 * as a filler rather than a peer.
 *
 * <h3>Base confidence by source kind</h3>
 * <pre>
 *   API        → 90
 *   SCRAPED    → min(85, 70 + listingCount)
 *   SIMULATED  → adapter hint clamped to [40, 70] (40 when absent)
 * </pre>
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Primary observation: first API answer in family order, else first
 *       scraped, else first simulated. Its source type is reported.</li>
 *   <li>Included set: every API and scraped observation; simulated ones per
 *       {@link SimulatedInclusionPolicy}.</li>
 *   <li>{@code averagePrice} = arithmetic mean of included prices.</li>
 *   <li>{@code confidenceLevel} = primary base + {@value #REAL_BONUS} per other
 *       included real observation + {@value #SIMULATED_BONUS} per other included
 *       simulated one, capped at 100.</li>
 *   <li>Median, min and max come from the primary's distribution when it has one,
 *       otherwise from the included prices.</li>
 *   <li>The condition histogram is the primary's; simulated primaries have none.</li>
 * </ol>
 *
 * <p>No observations → {@link ConsensusResult#noData}. Stateless and thread-safe.
 */
public class ConfidenceWeightedConsensusStrategy implements ConsensusEngine {

    static final double API_CONFIDENCE           = 90.0;
    static final double SCRAPE_BASE_CONFIDENCE   = 70.0;
    static final double SCRAPE_MAX_CONFIDENCE    = 85.0;
    static final double SIMULATED_MIN_CONFIDENCE = 40.0;
    static final double SIMULATED_MAX_CONFIDENCE = 70.0;
    static final double REAL_BONUS               = 10.0;
    static final double SIMULATED_BONUS          = 5.0;
    static final double MAX_CONFIDENCE           = 100.0;

    public static final int DEFAULT_FILLER_THRESHOLD = 2;

    private final SimulatedInclusionPolicy policy;
    private final int fillerThreshold;

    public ConfidenceWeightedConsensusStrategy() {
        this(SimulatedInclusionPolicy.FILLER, DEFAULT_FILLER_THRESHOLD);
    }

    public ConfidenceWeightedConsensusStrategy(SimulatedInclusionPolicy policy, int fillerThreshold) {
        this.policy          = policy;
        this.fillerThreshold = fillerThreshold;
    }

    @Override
    public ConsensusResult fuse(String query, List<Observation> observations, Instant now) {
        InstrumentCategory category = InstrumentCategoryClassifier.classify(query);
        if (observations == null || observations.isEmpty()) {
            return ConsensusResult.noData(query, category, now);
        }

        Observation primary = selectPrimary(observations);
        List<Observation> included = selectIncluded(observations);

        Map<String, Double> sources = new LinkedHashMap<>();
        List<Double> prices = new ArrayList<>(included.size());
        int listingCount = 0;
        for (Observation o : included) {
            sources.put(o.sourceType(), o.price());
            prices.add(o.price());
            listingCount += o.count();
        }
        PriceStatistics spread = PriceStatistics.ofPrices(prices);

        Double median;
        Double min;
        Double max;
        if (primary.hasDistribution()) {
            median = primary.medianPrice();
            min    = primary.minPrice();
            max    = primary.maxPrice();
        } else {
            median = spread.median();
            min    = spread.min();
            max    = spread.max();
        }

        return new ConsensusResult(
            query,
            spread.average(),
            median, min, max,
            confidence(primary, included),
            sources,
            primary.sourceType(),
            included.size(),
            listingCount,
            primary.conditionCounts(),
            PriceVolatility.of(min, max, median),
            category,
            now);
    }

    // ── selection ─────────────────────────────────────────────────────────────

    static Observation selectPrimary(List<Observation> observations) {
        for (SourceKind kind : SourceKind.values()) {
            for (Observation o : observations) {
                if (o.sourceKind() == kind) {
                    return o;
                }
            }
        }
        return observations.get(0);
    }

    List<Observation> selectIncluded(List<Observation> observations) {
        List<Observation> real = new ArrayList<>();
        List<Observation> simulated = new ArrayList<>();
        for (Observation o : observations) {
            if (o.sourceKind() == SourceKind.SIMULATED) {
                simulated.add(o);
            } else {
                real.add(o);
            }
        }
        boolean includeSimulated = switch (policy) {
            case ALWAYS -> true;
            case NEVER  -> real.isEmpty();
            case FILLER -> real.isEmpty() || real.size() < fillerThreshold;
        };
        List<Observation> included = new ArrayList<>(observations.size());
        for (Observation o : observations) {
            if (o.sourceKind() != SourceKind.SIMULATED || includeSimulated) {
                included.add(o);
            }
        }
        return included;
    }

    // ── confidence ────────────────────────────────────────────────────────────

    static double baseConfidence(Observation o) {
        return switch (o.sourceKind()) {
            case API -> API_CONFIDENCE;
            case SCRAPED -> Math.min(SCRAPE_MAX_CONFIDENCE, SCRAPE_BASE_CONFIDENCE + o.count());
            case SIMULATED -> simulatedConfidence(o.confidenceHint());
        };
    }

    private static double simulatedConfidence(Double hint) {
        double value = hint != null ? hint : SIMULATED_MIN_CONFIDENCE;
        return Math.max(SIMULATED_MIN_CONFIDENCE, Math.min(SIMULATED_MAX_CONFIDENCE, value));
    }

    static double confidence(Observation primary, List<Observation> included) {
        double confidence = baseConfidence(primary);
        for (Observation o : included) {
            if (o == primary) {
                continue;
            }
            confidence += o.sourceKind() == SourceKind.SIMULATED ? SIMULATED_BONUS : REAL_BONUS;
        }
        return Math.min(MAX_CONFIDENCE, confidence);
    }
}
