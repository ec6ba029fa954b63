package com.gearprice.common.model;

/**
 * Spread of observed prices relative to the median:
 * {@code (max - min) / median * 100}.
 *
 * <pre>
 *   &lt;= 20%  → LOW
 *   &lt;= 50%  → MEDIUM
 *   &gt;  50%  → HIGH
 * </pre>
 */
public enum PriceVolatility {
    LOW,
    MEDIUM,
    HIGH,
    UNKNOWN;

    public static PriceVolatility of(Double min, Double max, Double median) {
        if (min == null || max == null || median == null || median <= 0.0) {
            return UNKNOWN;
        }
        double spreadPct = (max - min) / median * 100.0;
        if (spreadPct <= 20.0) return LOW;
        if (spreadPct <= 50.0) return MEDIUM;
        return HIGH;
    }
}
