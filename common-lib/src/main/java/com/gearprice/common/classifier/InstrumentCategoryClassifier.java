package com.gearprice.common.classifier;

import com.gearprice.common.model.InstrumentCategory;

import java.util.List;
import java.util.Locale;

/**
 * Pure stateless classifier mapping an item description to an
 * {@link InstrumentCategory}.
 *
 * <p>Rules are evaluated in priority order; the first keyword hit wins.
 * Bass is tested before guitar so that "jazz bass guitar" is a bass.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class InstrumentCategoryClassifier {

    private static final List<String> ELECTRIC_HINTS =
        List.of("electric", "stratocaster", "strat", "telecaster", "les paul", "sg", "polara", "jazzmaster");
    private static final List<String> ACOUSTIC_HINTS =
        List.of("acoustic", "parlor", "dreadnought");
    private static final List<String> GUITAR_HINTS =
        List.of("guitar", "stratocaster", "telecaster", "les paul", "sg", "acoustic", "parlor");

    private InstrumentCategoryClassifier() {}

    public static InstrumentCategory classify(String description) {
        if (description == null || description.isBlank()) {
            return InstrumentCategory.OTHER;
        }
        String text = " " + description.toLowerCase(Locale.ROOT) + " ";

        if (containsWord(text, "bass")) {
            return InstrumentCategory.BASS_GUITAR;
        }
        if (containsAny(text, GUITAR_HINTS)) {
            if (containsAny(text, ELECTRIC_HINTS)) return InstrumentCategory.ELECTRIC_GUITAR;
            if (containsAny(text, ACOUSTIC_HINTS)) return InstrumentCategory.ACOUSTIC_GUITAR;
            return InstrumentCategory.GUITAR;
        }
        if (containsAny(text, List.of("ukulele", "uke"))) {
            return InstrumentCategory.UKULELE;
        }
        if (containsWord(text, "mandolin")) {
            return InstrumentCategory.MANDOLIN;
        }
        if (containsAny(text, List.of("conga", "percussion", "drum", "cymbal", "snare"))) {
            return InstrumentCategory.PERCUSSION;
        }
        if (containsAny(text, List.of("pedal", "delay", "overdrive", "distortion", "fuzz", "electronics"))) {
            return InstrumentCategory.EFFECTS_PEDAL;
        }
        if (containsAny(text, List.of("amp", "amplifier", "combo", "cabinet"))) {
            return InstrumentCategory.AMPLIFIER;
        }
        if (containsWord(text, "resonator")) {
            return InstrumentCategory.RESONATOR;
        }
        return InstrumentCategory.OTHER;
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (containsWord(text, word)) {
                return true;
            }
        }
        return false;
    }

    /** Whole-word match on a space-padded, lower-cased text. */
    private static boolean containsWord(String text, String word) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(word, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + word.length();
            if (!Character.isLetterOrDigit(text.charAt(idx - 1))
                    && (end >= text.length() || !Character.isLetterOrDigit(text.charAt(end)))) {
                return true;
            }
            from = idx + 1;
        }
    }
}
