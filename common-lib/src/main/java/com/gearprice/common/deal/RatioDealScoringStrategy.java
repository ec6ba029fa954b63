package com.gearprice.common.deal;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.DealAssessment;
import com.gearprice.common.model.DealScheme;

/**
 * Ratio scheme: {@code dealScore = referencePrice / consensusPrice}, lower is better.
 *
 * <pre>
 *   score &lt;= dealThreshold        → good_deal
 *   score &gt;= overpricedThreshold  → overpriced
 *   otherwise                      → fair_price
 * </pre>
 *
 * <p>The consensus price is the average or the median, per {@link ConsensusReference}.
 * A consensus price of zero scores {@code +Infinity} and is therefore overpriced.
 */
public class RatioDealScoringStrategy implements DealScoringStrategy {

    public static final String GOOD_DEAL  = "good_deal";
    public static final String FAIR_PRICE = "fair_price";
    public static final String OVERPRICED = "overpriced";

    public static final double DEFAULT_DEAL_THRESHOLD       = 0.85;
    public static final double DEFAULT_OVERPRICED_THRESHOLD = 1.15;

    private final double dealThreshold;
    private final double overpricedThreshold;
    private final ConsensusReference reference;

    public RatioDealScoringStrategy() {
        this(DEFAULT_DEAL_THRESHOLD, DEFAULT_OVERPRICED_THRESHOLD);
    }

    public RatioDealScoringStrategy(double dealThreshold, double overpricedThreshold) {
        this(dealThreshold, overpricedThreshold, ConsensusReference.AVERAGE);
    }

    public RatioDealScoringStrategy(double dealThreshold, double overpricedThreshold,
                                    ConsensusReference reference) {
        if (dealThreshold >= overpricedThreshold) {
            throw new IllegalArgumentException(
                "dealThreshold must be below overpricedThreshold: " + dealThreshold + " >= " + overpricedThreshold);
        }
        this.dealThreshold       = dealThreshold;
        this.overpricedThreshold = overpricedThreshold;
        this.reference           = reference;
    }

    @Override
    public DealScheme scheme() {
        return DealScheme.RATIO;
    }

    @Override
    public DealAssessment assess(double referencePrice, ConsensusResult consensus) {
        double consensusPrice = reference.priceOf(consensus);
        double score = consensusPrice > 0.0 ? referencePrice / consensusPrice : Double.POSITIVE_INFINITY;
        return new DealAssessment(DealScheme.RATIO, referencePrice, consensusPrice, score,
            categorize(score), consensus.confidenceLevel(), null, consensus.sourceType());
    }

    public String categorize(double score) {
        if (score <= dealThreshold)       return GOOD_DEAL;
        if (score >= overpricedThreshold) return OVERPRICED;
        return FAIR_PRICE;
    }
}
