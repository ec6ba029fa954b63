package com.gearprice.marketdata.source;

import com.gearprice.common.model.Observation;
import com.gearprice.common.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort price estimate built from brand and instrument type heuristics.
 *
 * <p>Never returns empty. The confidence hint starts at 40 and gains 15 for a
 * recognised brand and 15 for a recognised instrument type, so an estimate for
 * {@code "fender stratocaster guitar"} is trusted more than one for {@code "thing"}.
 */
public class SimulatedPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPriceAdapter.class);

    private static final Pattern BRAND = Pattern.compile(
        "\\b(gibson|fender|martin|taylor|prs|gretsch|ibanez|epiphone|roland|boss)\\b");

    private static final Set<String> PREMIUM_GUITAR_BRANDS = Set.of("gibson", "fender", "prs", "martin", "taylor");
    private static final Set<String> PREMIUM_BASS_BRANDS   = Set.of("fender", "gibson");

    private static final List<String> GUITAR_TERMS = List.of("guitar", "strat", "les paul", "telecaster", "sg");
    private static final List<String> AMP_TERMS    = List.of("amp", "amplifier");
    private static final List<String> PEDAL_TERMS  = List.of("pedal", "effect", "delay", "reverb", "overdrive");

    static final double BASE_HINT       = 40.0;
    static final double HINT_PER_MATCH  = 15.0;
    static final double JITTER_MIN      = 0.9;
    static final double JITTER_MAX      = 1.1;

    private final String family;
    private final double minMultiplier;
    private final double maxMultiplier;
    private final Random random;
    private final Clock clock;

    public SimulatedPriceAdapter(String family, double minMultiplier, double maxMultiplier,
                                 Random random, Clock clock) {
        if (minMultiplier <= 0 || maxMultiplier < minMultiplier) {
            throw new IllegalArgumentException(
                "Invalid multiplier range [" + minMultiplier + ", " + maxMultiplier + "]");
        }
        this.family        = family;
        this.minMultiplier = minMultiplier;
        this.maxMultiplier = maxMultiplier;
        this.random        = random;
        this.clock         = clock;
    }

    @Override
    public String family() {
        return family;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SIMULATED;
    }

    @Override
    public Mono<Observation> fetch(String query) {
        return Mono.fromSupplier(() -> estimate(query));
    }

    Observation estimate(String query) {
        String text = query.toLowerCase(Locale.ROOT);
        Matcher brandMatch = BRAND.matcher(text);
        String brand = brandMatch.find() ? brandMatch.group(1) : "";

        PriceRange range = rangeFor(text, brand);
        double base  = uniform(range.low(), range.high());
        double price = Math.max(1.0, Math.round(base * uniform(JITTER_MIN, JITTER_MAX) * uniform(minMultiplier, maxMultiplier)));

        double hint = BASE_HINT;
        if (!brand.isEmpty()) hint += HINT_PER_MATCH;
        if (range.typed())     hint += HINT_PER_MATCH;

        log.debug("SIMULATED_ESTIMATE family={} query={} brand={} price={} hint={}",
                  family, query, brand.isEmpty() ? "-" : brand, price, hint);
        return Observation.simulated(family, price, hint, clock.instant());
    }

    static PriceRange rangeFor(String text, String brand) {
        if (containsAny(text, GUITAR_TERMS)) {
            return PREMIUM_GUITAR_BRANDS.contains(brand)
                ? new PriceRange(800, 3000, true) : new PriceRange(300, 1200, true);
        }
        if (text.contains("bass")) {
            return PREMIUM_BASS_BRANDS.contains(brand)
                ? new PriceRange(700, 2500, true) : new PriceRange(400, 1000, true);
        }
        if (containsAny(text, AMP_TERMS))   return new PriceRange(300, 1500, true);
        if (containsAny(text, PEDAL_TERMS)) return new PriceRange(80, 300, true);
        return new PriceRange(200, 800, false);
    }

    private static boolean containsAny(String text, List<String> terms) {
        return terms.stream().anyMatch(text::contains);
    }

    private double uniform(double low, double high) {
        return low == high ? low : low + random.nextDouble() * (high - low);
    }

    record PriceRange(double low, double high, boolean typed) {}
}
