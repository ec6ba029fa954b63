package com.gearprice.marketdata.source;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a positive amount from marketplace price text such as {@code "$1,299.99"},
 * {@code "US $45.00"} or {@code "$100.00 to $150.00"} (ranges use the low end).
 */
final class PriceTextParser {

    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");

    private PriceTextParser() {}

    static OptionalDouble parse(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        Matcher m = AMOUNT.matcher(text);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(m.group(1).replace(",", ""));
            return value > 0.0 && Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
