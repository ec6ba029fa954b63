package com.gearprice.common.model;

/**
 * Independently selectable deal classifiers.
 *
 * <ul>
 *   <li>{@link #RATIO}: {@code reference / consensus} against good-deal and overpriced thresholds</li>
 *   <li>{@link #SAVINGS_PERCENT}: percentage below consensus bucketed into named tiers</li>
 * </ul>
 */
public enum DealScheme {
    RATIO,
    SAVINGS_PERCENT
}
