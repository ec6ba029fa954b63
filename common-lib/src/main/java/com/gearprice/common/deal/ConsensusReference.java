package com.gearprice.common.deal;

import com.gearprice.common.model.ConsensusResult;

/**
 * Which consensus figure a reference price is judged against.
 *
 * <p>{@link #MEDIAN} falls back to the average when the consensus has no positive median.
 */
public enum ConsensusReference {
    AVERAGE,
    MEDIAN;

    public double priceOf(ConsensusResult consensus) {
        if (this == MEDIAN) {
            Double median = consensus.medianPrice();
            if (median != null && median > 0.0) {
                return median;
            }
        }
        return consensus.averagePrice();
    }
}
