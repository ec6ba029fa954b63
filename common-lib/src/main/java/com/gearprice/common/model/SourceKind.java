package com.gearprice.common.model;

/**
 * Method used to obtain an {@link Observation} within a source family.
 *
 * <p>Declaration order is the fallback priority: a structured API answer is
 * preferred over a scraped one, and simulated data is the last resort.
 */
public enum SourceKind {
    API("api"),
    SCRAPED("scraped"),
    SIMULATED("simulated");

    private final String tag;

    SourceKind(String tag) {
        this.tag = tag;
    }

    /** Lower-case tag used in persisted {@code source_type} values, e.g. {@code ebay_scraped}. */
    public String tag() {
        return tag;
    }
}
