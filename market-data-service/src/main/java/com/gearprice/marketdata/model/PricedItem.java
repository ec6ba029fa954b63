package com.gearprice.marketdata.model;

import com.gearprice.common.model.ConsensusResult;

/** One batch pricing result, keyed by the caller's raw description. */
public record PricedItem(String description, ConsensusResult consensus) {}
