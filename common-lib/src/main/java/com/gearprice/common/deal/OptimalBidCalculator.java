package com.gearprice.common.deal;

import com.gearprice.common.model.ListingCondition;

import java.util.Map;
import java.util.Set;

/**
 * Target price a bidder should aim for.
 *
 * <pre>
 *   marketWeight = 0.7 (confidence &gt;= 80) | 0.6 (&gt;= 50) | 0.4 (otherwise)
 *   blended      = consensus × marketWeight + retail × (1 − marketWeight)
 *   target       = blended × auctionDiscount × (1 + 0.1 × premiumShare)
 * </pre>
 *
 * <p>{@code premiumShare} is the fraction of listings behind the consensus in New
 * or Like New condition, so a market dominated by mint gear lifts the target by
 * up to 10%.
 *
 * <p>Without a retail price the consensus alone is discounted; without a
 * consensus price the retail price alone is. With neither there is no target.
 */
public class OptimalBidCalculator {

    public static final double DEFAULT_AUCTION_DISCOUNT = 0.85;

    static final double HIGH_CONFIDENCE   = 80.0;
    static final double MEDIUM_CONFIDENCE = 50.0;
    static final double PREMIUM_CONDITION_BONUS = 0.1;

    private static final Set<String> PREMIUM_CONDITIONS =
        Set.of(ListingCondition.NEW.label(), ListingCondition.LIKE_NEW.label());

    private final double auctionDiscount;

    public OptimalBidCalculator() {
        this(DEFAULT_AUCTION_DISCOUNT);
    }

    public OptimalBidCalculator(double auctionDiscount) {
        this.auctionDiscount = auctionDiscount;
    }

    /**
     * @param consensusPrice fused market price, 0 when unknown
     * @param retailPrice    list/retail price, may be {@code null}
     * @param confidence     consensus confidence level, 0–100
     * @return discounted target price, or {@code null} when neither price is known
     */
    public Double targetPrice(double consensusPrice, Double retailPrice, double confidence) {
        return targetPrice(consensusPrice, retailPrice, confidence, Map.of());
    }

    /**
     * @param conditionCounts condition label → listing count of the consensus, may be empty
     */
    public Double targetPrice(double consensusPrice, Double retailPrice, double confidence,
                              Map<String, Integer> conditionCounts) {
        boolean hasMarket = consensusPrice > 0.0;
        boolean hasRetail = retailPrice != null && retailPrice > 0.0;

        double base;
        if (hasMarket && hasRetail) {
            double marketWeight = marketWeight(confidence);
            base = consensusPrice * marketWeight + retailPrice * (1.0 - marketWeight);
        } else if (hasMarket) {
            base = consensusPrice;
        } else if (hasRetail) {
            base = retailPrice;
        } else {
            return null;
        }
        return base * auctionDiscount * (1.0 + PREMIUM_CONDITION_BONUS * premiumShare(conditionCounts));
    }

    static double premiumShare(Map<String, Integer> conditionCounts) {
        if (conditionCounts == null || conditionCounts.isEmpty()) {
            return 0.0;
        }
        int total = 0;
        int premium = 0;
        for (Map.Entry<String, Integer> e : conditionCounts.entrySet()) {
            int n = e.getValue() == null ? 0 : e.getValue();
            total += n;
            if (PREMIUM_CONDITIONS.contains(e.getKey())) {
                premium += n;
            }
        }
        return total == 0 ? 0.0 : (double) premium / total;
    }

    static double marketWeight(double confidence) {
        if (confidence >= HIGH_CONFIDENCE)   return 0.7;
        if (confidence >= MEDIUM_CONFIDENCE) return 0.6;
        return 0.4;
    }
}
