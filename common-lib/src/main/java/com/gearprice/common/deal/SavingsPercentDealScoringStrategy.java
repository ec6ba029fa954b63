package com.gearprice.common.deal;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.DealAssessment;
import com.gearprice.common.model.DealScheme;

/**
 * Percentage-savings scheme:
 * {@code percentSavings = (consensus - reference) / consensus * 100}, higher is better.
 *
 * <pre>
 *   reference &gt;= consensus              → Overpriced
 *   &gt;= 60 and enough listings behind it → Exceptional
 *   &gt;= 50                               → Great
 *   &gt;= 30                               → Good
 *   &gt;= 15                               → Fair
 *   &gt;  0                                → Slight
 *   no consensus price                  → Not a Deal
 * </pre>
 *
 * <p>The consensus price is the average or the median, per {@link ConsensusReference}.
 * A 60%+ saving backed by fewer than {@code exceptionalMinListings} listings
 * is reported as Great.
 */
public class SavingsPercentDealScoringStrategy implements DealScoringStrategy {

    static final double EXCEPTIONAL_PCT = 60.0;
    static final double GREAT_PCT       = 50.0;
    static final double GOOD_PCT        = 30.0;
    static final double FAIR_PCT        = 15.0;

    public static final int DEFAULT_EXCEPTIONAL_MIN_LISTINGS = 5;

    private final int exceptionalMinListings;
    private final ConsensusReference reference;

    public SavingsPercentDealScoringStrategy() {
        this(DEFAULT_EXCEPTIONAL_MIN_LISTINGS);
    }

    public SavingsPercentDealScoringStrategy(int exceptionalMinListings) {
        this(exceptionalMinListings, ConsensusReference.AVERAGE);
    }

    public SavingsPercentDealScoringStrategy(int exceptionalMinListings, ConsensusReference reference) {
        this.exceptionalMinListings = exceptionalMinListings;
        this.reference              = reference;
    }

    @Override
    public DealScheme scheme() {
        return DealScheme.SAVINGS_PERCENT;
    }

    @Override
    public DealAssessment assess(double referencePrice, ConsensusResult consensus) {
        double consensusPrice = reference.priceOf(consensus);
        if (consensusPrice <= 0.0) {
            return new DealAssessment(DealScheme.SAVINGS_PERCENT, referencePrice, consensusPrice,
                Double.NEGATIVE_INFINITY, SavingsTier.NOT_A_DEAL.label(),
                consensus.confidenceLevel(), null, consensus.sourceType());
        }
        double percent = (consensusPrice - referencePrice) / consensusPrice * 100.0;
        SavingsTier tier = tier(percent, consensus.listingCount());
        return new DealAssessment(DealScheme.SAVINGS_PERCENT, referencePrice, consensusPrice,
            percent, tier.label(), consensus.confidenceLevel(), null, consensus.sourceType());
    }

    public SavingsTier tier(double percentSavings, int listingCount) {
        if (percentSavings <= 0.0) return SavingsTier.OVERPRICED;
        if (percentSavings >= EXCEPTIONAL_PCT && listingCount >= exceptionalMinListings) {
            return SavingsTier.EXCEPTIONAL;
        }
        if (percentSavings >= GREAT_PCT) return SavingsTier.GREAT;
        if (percentSavings >= GOOD_PCT)  return SavingsTier.GOOD;
        if (percentSavings >= FAIR_PCT)  return SavingsTier.FAIR;
        return SavingsTier.SLIGHT;
    }
}
