package com.gearprice.common.model;

import java.util.List;
import java.util.Locale;

/**
 * Fixed condition vocabulary that marketplace condition text is normalized into.
 *
 * <p>Matching is keyword based and ordered: more specific phrases ("open box",
 * "like new", "for parts") are tested before the generic ones ("new", "good").
 * Text that matches nothing is treated as {@link #USED}.
 */
public enum ListingCondition {
    NEW("New", List.of("brand new", "new")),
    OPEN_BOX("Open Box", List.of("open box", "open-box")),
    LIKE_NEW("Like New", List.of("like new", "mint", "excellent")),
    VERY_GOOD("Very Good", List.of("very good")),
    GOOD("Good", List.of("good")),
    FAIR("Fair", List.of("fair")),
    POOR("Poor/For Parts", List.of("for parts", "not working", "poor", "non-functioning")),
    REFURBISHED("Refurbished", List.of("refurbished", "remanufactured")),
    USED("Used", List.of("pre-owned", "used")),
    UNKNOWN("Unknown", List.of());

    /** Evaluation order for {@link #fromText(String)}. */
    private static final List<ListingCondition> MATCH_ORDER = List.of(
        OPEN_BOX, LIKE_NEW, POOR, REFURBISHED, VERY_GOOD, NEW, GOOD, FAIR, USED
    );

    private final String label;
    private final List<String> keywords;

    ListingCondition(String label, List<String> keywords) {
        this.label    = label;
        this.keywords = keywords;
    }

    public String label() {
        return label;
    }

    public static ListingCondition fromText(String text) {
        if (text == null || text.isBlank()) {
            return USED;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (ListingCondition condition : MATCH_ORDER) {
            for (String keyword : condition.keywords) {
                if (lower.contains(keyword)) {
                    return condition;
                }
            }
        }
        return USED;
    }
}
