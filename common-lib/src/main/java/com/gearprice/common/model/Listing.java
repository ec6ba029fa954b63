package com.gearprice.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One parsed marketplace row (sold or active listing).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Listing(
    String title,
    double price,
    ListingCondition condition,
    String url
) {}
