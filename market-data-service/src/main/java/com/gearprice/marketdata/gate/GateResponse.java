package com.gearprice.marketdata.gate;

/**
 * Outcome of a gated request. The gate never signals an error; transport
 * failures surface here with {@code status = -1} and a {@code failureReason}.
 */
public record GateResponse(int status, String body, String failureReason) {

    public static final int NO_STATUS = -1;

    public static GateResponse of(int status, String body) {
        return new GateResponse(status, body, null);
    }

    public static GateResponse failure(String reason) {
        return new GateResponse(NO_STATUS, "", reason);
    }

    public boolean isSuccess() {
        return failureReason == null && status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public String describe() {
        return failureReason != null ? failureReason : "HTTP " + status;
    }
}
