package com.gearprice.common.consensus;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.Observation;

import java.time.Instant;
import java.util.List;

/**
 * Strategy contract for fusing per-family observations into one consensus price.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Non-null</b>: must always return a valid {@link ConsensusResult},
 *       including for an empty observation list</li>
 * </ul>
 *
 * <p>Current implementation: {@link ConfidenceWeightedConsensusStrategy}.
 * Register as a Spring {@code @Bean} in {@code PricingConfig} to swap strategies
 * without changing any downstream code.
 */
public interface ConsensusEngine {

    /**
     * @param query        normalized query the observations answer
     * @param observations per-family observations in family order; may be empty
     * @param now          timestamp stamped on the result
     * @return a {@link ConsensusResult}, never {@code null}
     */
    ConsensusResult fuse(String query, List<Observation> observations, Instant now);
}
