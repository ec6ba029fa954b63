package com.gearprice.common.consensus;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.InstrumentCategory;
import com.gearprice.common.model.Listing;
import com.gearprice.common.model.ListingCondition;
import com.gearprice.common.model.Observation;
import com.gearprice.common.model.PriceVolatility;
import com.gearprice.common.model.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.DoubleStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ConfidenceWeightedConsensusStrategy}:
 * primary selection, inclusion policies, confidence bonuses and cap.
 */
class ConfidenceWeightedConsensusStrategyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ConfidenceWeightedConsensusStrategy engine = new ConfidenceWeightedConsensusStrategy();

    private static Observation listings(String family, SourceKind kind, double... prices) {
        List<Listing> rows = new ArrayList<>();
        for (double price : prices) {
            rows.add(new Listing(family + " listing", price, ListingCondition.GOOD, null));
        }
        return Observation.fromListings(family, kind, rows, NOW);
    }

    private static Observation simulated(String family, double price, Double hint) {
        return new Observation(family, SourceKind.SIMULATED, price, null, null, null, 0,
            null, null, hint, NOW);
    }

    // ── no data ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("no observations → no_data with zero price and confidence")
    void noObservations() {
        ConsensusResult result = engine.fuse("fender stratocaster", List.of(), NOW);

        assertEquals(0.0, result.averagePrice());
        assertEquals(0.0, result.confidenceLevel());
        assertEquals(ConsensusResult.NO_DATA, result.sourceType());
        assertEquals(InstrumentCategory.ELECTRIC_GUITAR, result.category());
        assertFalse(result.hasData());
    }

    // ── base confidence ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("base confidence")
    class BaseConfidence {

        @Test
        @DisplayName("scraped listings: 70 + listing count")
        void scrapedOnly() {
            ConsensusResult result = engine.fuse("fender stratocaster",
                List.of(listings("eBay", SourceKind.SCRAPED, 700, 750, 800, 820, 900)), NOW);

            assertEquals(800.0, result.medianPrice());
            assertEquals(794.0, result.averagePrice(), 1e-9);
            assertEquals(75.0, result.confidenceLevel());
            assertEquals("ebay_scraped", result.sourceType());
            assertEquals(5, result.listingCount());
            assertEquals(PriceVolatility.MEDIUM, result.volatility());
        }

        @Test
        @DisplayName("scraped confidence caps at 85")
        void scrapedCap() {
            double[] prices = DoubleStream.iterate(500, p -> p + 5).limit(30).toArray();
            ConsensusResult result = engine.fuse("q", List.of(listings("Reverb", SourceKind.SCRAPED, prices)), NOW);
            assertEquals(85.0, result.confidenceLevel());
        }

        @Test
        @DisplayName("API answer starts at 90")
        void api() {
            ConsensusResult result = engine.fuse("q", List.of(listings("Reverb", SourceKind.API, 1000)), NOW);
            assertEquals(90.0, result.confidenceLevel());
            assertEquals("reverb_api", result.sourceType());
        }

        @Test
        @DisplayName("simulated hint is clamped to [40, 70], absent hint → 40")
        void simulatedHint() {
            assertEquals(55.0, engine.fuse("q", List.of(simulated("Reverb", 900, 55.0)), NOW).confidenceLevel());
            assertEquals(70.0, engine.fuse("q", List.of(simulated("Reverb", 900, 95.0)), NOW).confidenceLevel());
            assertEquals(40.0, engine.fuse("q", List.of(simulated("Reverb", 900, 10.0)), NOW).confidenceLevel());
            assertEquals(40.0, engine.fuse("q", List.of(simulated("Reverb", 900, null)), NOW).confidenceLevel());
        }
    }

    @Test
    @DisplayName("condition histogram is taken from the primary observation")
    void conditionCountsFromPrimary() {
        List<Listing> rows = List.of(
            new Listing("a", 900, ListingCondition.NEW, null),
            new Listing("b", 950, ListingCondition.LIKE_NEW, null),
            new Listing("c", 800, ListingCondition.USED, null));
        Observation api = Observation.fromListings("Reverb", SourceKind.API, rows, NOW);
        Observation scrape = listings("eBay", SourceKind.SCRAPED, 700, 750);

        ConsensusResult result = engine.fuse("q", List.of(scrape, api), NOW);

        assertEquals("reverb_api", result.sourceType());
        assertEquals(1, result.conditionCounts().get("New"));
        assertEquals(1, result.conditionCounts().get("Like New"));
        assertEquals(1, result.conditionCounts().get("Used"));
        assertNull(result.conditionCounts().get("Good"));
        assertTrue(engine.fuse("q", List.of(simulated("Reverb", 900, 55.0)), NOW).conditionCounts().isEmpty());
    }

    // ── bonuses ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("agreement bonuses")
    class Bonuses {

        @Test
        @DisplayName("each additional real observation adds 10, capped at 100")
        void realBonusAndCap() {
            Observation reverbApi = listings("Reverb", SourceKind.API, 1000);
            Observation ebayScrape = listings("eBay", SourceKind.SCRAPED, 900, 950);
            Observation extra = listings("Sweetwater", SourceKind.SCRAPED, 1100);

            assertEquals(100.0, engine.fuse("q", List.of(reverbApi, ebayScrape), NOW).confidenceLevel());
            assertEquals(100.0, engine.fuse("q", List.of(reverbApi, ebayScrape, extra), NOW).confidenceLevel());
        }

        @Test
        @DisplayName("adding a real observation never lowers confidence")
        void monotonic() {
            Observation first = listings("Reverb", SourceKind.SCRAPED, 800, 850);
            Observation second = listings("eBay", SourceKind.SCRAPED, 700);

            double one = engine.fuse("q", List.of(first), NOW).confidenceLevel();
            double two = engine.fuse("q", List.of(first, second), NOW).confidenceLevel();

            assertEquals(72.0, one);
            assertEquals(82.0, two);
            assertTrue(two >= one);
        }

        @Test
        @DisplayName("included simulated filler adds 5")
        void simulatedBonus() {
            ConsensusResult result = engine.fuse("q",
                List.of(listings("Reverb", SourceKind.API, 1000), simulated("eBay", 800, 70.0)), NOW);

            assertEquals(95.0, result.confidenceLevel());
            assertEquals(900.0, result.averagePrice(), 1e-9);
            assertEquals(2, result.count());
        }
    }

    // ── primary and inclusion ─────────────────────────────────────────────────

    @Nested
    @DisplayName("primary selection and simulated inclusion")
    class Inclusion {

        @Test
        @DisplayName("a real observation is primary even when a simulated one comes first")
        void realPrimary() {
            ConsensusResult result = engine.fuse("q",
                List.of(simulated("Reverb", 2000, 70.0), listings("eBay", SourceKind.SCRAPED, 700, 800, 900)), NOW);

            assertEquals("ebay_scraped", result.sourceType());
            assertEquals(800.0, result.medianPrice());
            assertEquals(700.0, result.minPrice());
            assertEquals(900.0, result.maxPrice());
        }

        @Test
        @DisplayName("FILLER: simulated data is dropped once enough real observations exist")
        void fillerDropped() {
            ConsensusResult result = engine.fuse("q", List.of(
                listings("Reverb", SourceKind.API, 1000),
                listings("eBay", SourceKind.SCRAPED, 900),
                simulated("Sweetwater", 5000, 70.0)), NOW);

            assertEquals(2, result.count());
            assertEquals(950.0, result.averagePrice(), 1e-9);
            assertFalse(result.sources().containsKey("sweetwater_simulated"));
        }

        @Test
        @DisplayName("NEVER: simulated data is still used when nothing else exists")
        void neverFallsBack() {
            ConfidenceWeightedConsensusStrategy never =
                new ConfidenceWeightedConsensusStrategy(SimulatedInclusionPolicy.NEVER, 2);

            ConsensusResult withReal = never.fuse("q",
                List.of(listings("Reverb", SourceKind.API, 1000), simulated("eBay", 500, 70.0)), NOW);
            assertEquals(1000.0, withReal.averagePrice(), 1e-9);
            assertEquals(90.0, withReal.confidenceLevel());

            ConsensusResult onlySimulated = never.fuse("q",
                List.of(simulated("Reverb", 1000, 55.0), simulated("eBay", 900, 55.0)), NOW);
            assertEquals(950.0, onlySimulated.averagePrice(), 1e-9);
            assertEquals(950.0, onlySimulated.medianPrice());
            assertEquals("reverb_simulated", onlySimulated.sourceType());
            assertEquals(60.0, onlySimulated.confidenceLevel());
        }

        @Test
        @DisplayName("ALWAYS: simulated data joins any number of real observations")
        void always() {
            ConfidenceWeightedConsensusStrategy always =
                new ConfidenceWeightedConsensusStrategy(SimulatedInclusionPolicy.ALWAYS, 2);

            ConsensusResult result = always.fuse("q", List.of(
                listings("Reverb", SourceKind.API, 1000),
                listings("eBay", SourceKind.SCRAPED, 900),
                simulated("Sweetwater", 1100, 70.0)), NOW);

            assertEquals(3, result.count());
            assertEquals(1000.0, result.averagePrice(), 1e-9);
            assertEquals(100.0, result.confidenceLevel());
        }

        @Test
        @DisplayName("sources map records the price used per source type, in family order")
        void sourcesMap() {
            ConsensusResult result = engine.fuse("q",
                List.of(listings("Reverb", SourceKind.API, 1000), listings("eBay", SourceKind.SCRAPED, 900)), NOW);

            assertEquals(List.of("reverb_api", "ebay_scraped"), new ArrayList<>(result.sources().keySet()));
            assertEquals(900.0, result.sources().get("ebay_scraped"));
        }
    }
}
