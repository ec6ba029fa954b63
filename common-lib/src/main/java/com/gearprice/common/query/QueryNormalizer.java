package com.gearprice.common.query;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw item description into the normalized query used for source
 * lookups and as the cache key.
 *
 * <p>Steps: strip case/bag accessories and condition or stock qualifiers,
 * drop punctuation noise, lower-case, collapse whitespace. Two descriptions
 * that differ only in those tokens normalize to the same query.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class QueryNormalizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> NOISE = List.of(
        Pattern.compile("\\b(?:w/|with)\\s*(?:original\\s+)?(?:hardshell|hard\\s*shell|hard|chipboard|gig|soft|tolex)?\\s*(?:case|bag)\\b", FLAGS),
        Pattern.compile("\\b(?:hardshell|hard\\s*shell|chipboard|gig|soft)\\s+(?:case|bag)\\b", FLAGS),
        Pattern.compile("\\b(?:nos|new old stock|brand new|new|retail|used|pre-owned|open box|mint|excellent|very good condition|good condition|fair condition)\\b", FLAGS),
        Pattern.compile("\\bw/", FLAGS)
    );

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s\\-'.&/+]");
    private static final Pattern STRAY       = Pattern.compile("(?<=^|\\s)[\\-'.&/+]+(?=\\s|$)");
    private static final Pattern WHITESPACE  = Pattern.compile("\\s+");

    private QueryNormalizer() {}

    /**
     * @param description raw item description
     * @return normalized, lower-cased query; never blank
     * @throws IllegalArgumentException when {@code description} is null or blank
     */
    public static String normalize(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Item description must not be blank");
        }
        String cleaned = description;
        for (Pattern noise : NOISE) {
            cleaned = noise.matcher(cleaned).replaceAll(" ");
        }
        cleaned = PUNCTUATION.matcher(cleaned).replaceAll(" ");
        cleaned = STRAY.matcher(cleaned).replaceAll(" ");
        cleaned = collapse(cleaned);

        // A description made only of noise words still needs a usable key.
        return cleaned.isEmpty() ? collapse(description) : cleaned;
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
