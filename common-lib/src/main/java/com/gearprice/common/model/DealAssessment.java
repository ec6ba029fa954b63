package com.gearprice.common.model;

/**
 * Classification of a reference price (typically an auction starting bid)
 * against a {@link ConsensusResult}.
 *
 * <p>{@code dealScore} is scheme dependent: a ratio for {@link DealScheme#RATIO}
 * (lower is better, {@code +Infinity} when there is no consensus price) and a
 * savings percentage for {@link DealScheme#SAVINGS_PERCENT} (higher is better).
 * {@code targetPrice} is null when it cannot be computed. {@code retailPrice} is
 * the retail figure blended into it, and {@code retailSource} says where that came
 * from: {@value #RETAIL_FROM_CALLER} or the source type of an estimate.
 */
public record DealAssessment(
    DealScheme scheme,
    double referencePrice,
    double consensusPrice,
    double dealScore,
    String category,
    double confidenceLevel,
    Double targetPrice,
    String sourceType,
    Double retailPrice,
    String retailSource
) {

    public static final String RETAIL_FROM_CALLER = "caller";

    public DealAssessment(DealScheme scheme, double referencePrice, double consensusPrice,
                          double dealScore, String category, double confidenceLevel,
                          Double targetPrice, String sourceType) {
        this(scheme, referencePrice, consensusPrice, dealScore, category, confidenceLevel,
            targetPrice, sourceType, null, null);
    }

    public DealAssessment withTarget(Double target, Double retail, String retailFrom) {
        return new DealAssessment(scheme, referencePrice, consensusPrice, dealScore,
            category, confidenceLevel, target, sourceType, retail, retailFrom);
    }
}
