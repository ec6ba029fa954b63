package com.gearprice.common.deal;

/**
 * Named tiers of the percentage-savings scheme, best first.
 */
public enum SavingsTier {
    EXCEPTIONAL("Exceptional"),
    GREAT("Great"),
    GOOD("Good"),
    FAIR("Fair"),
    SLIGHT("Slight"),
    NOT_A_DEAL("Not a Deal"),
    OVERPRICED("Overpriced");

    private final String label;

    SavingsTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
