package com.gearprice.common.deal;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.DealAssessment;
import com.gearprice.common.model.DealScheme;

/**
 * Classifies a reference price against a consensus result.
 *
 * <p>Implementations are stateless and never return {@code null}; a
 * {@code no_data} consensus yields the scheme's worst category.
 */
public interface DealScoringStrategy {

    DealScheme scheme();

    /**
     * @param referencePrice price being judged, e.g. an auction starting bid
     * @param consensus      fused market price for the item
     */
    DealAssessment assess(double referencePrice, ConsensusResult consensus);
}
