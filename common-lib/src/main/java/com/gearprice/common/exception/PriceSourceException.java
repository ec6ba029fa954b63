package com.gearprice.common.exception;

/**
 * Raised inside a source adapter when a response cannot be turned into an
 * observation. Never escapes the fallback chain: the orchestrator treats it as
 * "no answer from this adapter".
 */
public class PriceSourceException extends RuntimeException {
    private final String sourceFamily;

    public PriceSourceException(String sourceFamily, String message) {
        super("[" + sourceFamily + "] " + message);
        this.sourceFamily = sourceFamily;
    }

    public PriceSourceException(String sourceFamily, String message, Throwable cause) {
        super("[" + sourceFamily + "] " + message, cause);
        this.sourceFamily = sourceFamily;
    }

    public String getSourceFamily() {
        return sourceFamily;
    }
}
