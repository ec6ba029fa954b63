package com.gearprice.common.consensus;

/**
 * When simulated observations take part in the consensus average.
 *
 * <ul>
 *   <li>{@link #FILLER}: only while fewer than the configured threshold of
 *       non-simulated observations exist</li>
 *   <li>{@link #ALWAYS}: simulated prices are peers of real ones</li>
 *   <li>{@link #NEVER}: excluded whenever any real observation exists</li>
 * </ul>
 *
 * <p>Under every policy simulated data is used when nothing else is available,
 * so a result always carries a price while any adapter answered.
 */
public enum SimulatedInclusionPolicy {
    FILLER,
    ALWAYS,
    NEVER
}
