package com.gearprice.marketdata.source;

/**
 * Pagination limits for HTML scrape adapters.
 *
 * @param maxPages      hard page limit per query
 * @param pageSize      results requested per page
 * @param targetResults stop once this many listings were collected
 */
public record ScrapeSettings(int maxPages, int pageSize, int targetResults) {

    public static ScrapeSettings defaults() {
        return new ScrapeSettings(3, 60, 100);
    }

    /** A page with fewer results than this is treated as the last one. */
    public int shortPageThreshold() {
        return Math.max(1, pageSize / 2);
    }
}
