package com.gearprice.common.stats;

import com.gearprice.common.model.Listing;
import com.gearprice.common.model.ListingCondition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics over a set of listing prices.
 *
 * <p>Median rule: prices sorted ascending; odd count takes the middle element,
 * even count averages the two middle elements.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public record PriceStatistics(
    double average,
    double median,
    double min,
    double max,
    int count,
    Map<String, Integer> conditionCounts
) {

    public static PriceStatistics ofListings(List<Listing> listings) {
        List<Double> prices = new ArrayList<>(listings.size());
        Map<String, Integer> conditions = new LinkedHashMap<>();
        for (Listing listing : listings) {
            prices.add(listing.price());
            ListingCondition condition = listing.condition() != null
                ? listing.condition() : ListingCondition.UNKNOWN;
            conditions.merge(condition.label(), 1, Integer::sum);
        }
        PriceStatistics base = ofPrices(prices);
        return new PriceStatistics(base.average(), base.median(), base.min(), base.max(),
                                   base.count(), Collections.unmodifiableMap(conditions));
    }

    /**
     * @throws IllegalArgumentException when {@code prices} is empty
     */
    public static PriceStatistics ofPrices(Collection<Double> prices) {
        if (prices.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute statistics over zero prices");
        }
        List<Double> sorted = new ArrayList<>(prices);
        Collections.sort(sorted);
        double sum = 0.0;
        for (double p : sorted) {
            sum += p;
        }
        return new PriceStatistics(
            sum / sorted.size(),
            median(sorted),
            sorted.get(0),
            sorted.get(sorted.size() - 1),
            sorted.size(),
            Map.of());
    }

    /** Median of an ascending-sorted, non-empty list. */
    static double median(List<Double> sorted) {
        int n = sorted.size();
        int mid = n / 2;
        if (n % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }
}
