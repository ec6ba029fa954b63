package com.gearprice.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gearprice.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.gearprice.common.consensus.ConsensusEngine;
import com.gearprice.common.consensus.SimulatedInclusionPolicy;
import com.gearprice.common.deal.ConsensusReference;
import com.gearprice.common.deal.DealScoringStrategy;
import com.gearprice.common.deal.OptimalBidCalculator;
import com.gearprice.common.deal.RatioDealScoringStrategy;
import com.gearprice.common.deal.SavingsPercentDealScoringStrategy;
import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.Observation;
import com.gearprice.marketdata.cache.JsonFileCacheStore;
import com.gearprice.marketdata.gate.GateSettings;
import com.gearprice.marketdata.gate.RequestGate;
import com.gearprice.marketdata.orchestrator.FallbackOrchestrator;
import com.gearprice.marketdata.orchestrator.SourceFamilyChain;
import com.gearprice.marketdata.service.DealScoringService;
import com.gearprice.marketdata.service.MarketPriceService;
import com.gearprice.marketdata.source.EbayApiAdapter;
import com.gearprice.marketdata.source.EbayScrapeAdapter;
import com.gearprice.marketdata.source.ReverbApiAdapter;
import com.gearprice.marketdata.source.ReverbScrapeAdapter;
import com.gearprice.marketdata.source.ScrapeSettings;
import com.gearprice.marketdata.source.SimulatedPriceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Wires the pricing pipeline. Every collaborator is a plain class constructed here,
 * so tests build the same graph by hand.
 */
@Configuration
public class PricingConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingConfig.class);

    /** Retail store whose list prices are estimated for the target bid. */
    static final String RETAIL_FAMILY = "Sweetwater";

    @Value("${pricing.reverb.api-token:}")
    private String reverbApiToken;

    @Value("${pricing.ebay.api-token:}")
    private String ebayApiToken;

    @Value("${pricing.use-sandbox:false}")
    private boolean useSandbox;

    @Value("${pricing.cache.dir:cache}")
    private String cacheDir;

    @Value("${pricing.cache.consensus-ttl-days:7}")
    private long consensusTtlDays;

    @Value("${pricing.cache.scrape-ttl-hours:24}")
    private long scrapeTtlHours;

    @Value("${pricing.gate.min-request-interval-seconds:2}")
    private long minRequestIntervalSeconds;

    @Value("${pricing.gate.max-requests-per-session:20}")
    private int maxRequestsPerSession;

    @Value("${pricing.gate.session-rest-seconds:30}")
    private long sessionRestSeconds;

    @Value("${pricing.gate.max-retries:3}")
    private int maxRetries;

    @Value("${pricing.gate.rate-limit-backoff-seconds:5}")
    private long rateLimitBackoffSeconds;

    @Value("${pricing.gate.error-backoff-seconds:1}")
    private long errorBackoffSeconds;

    @Value("${pricing.gate.timeout-seconds:15}")
    private long timeoutSeconds;

    @Value("${pricing.scrape.max-pages:3}")
    private int scrapeMaxPages;

    @Value("${pricing.scrape.page-size:60}")
    private int scrapePageSize;

    @Value("${pricing.scrape.target-results:100}")
    private int scrapeTargetResults;

    @Value("${pricing.families:reverb,ebay}")
    private String[] families;

    @Value("${pricing.fusion.simulated-policy:FILLER}")
    private SimulatedInclusionPolicy simulatedPolicy;

    @Value("${pricing.fusion.filler-threshold:2}")
    private int fillerThreshold;

    @Value("${pricing.deal.threshold:0.85}")
    private double dealThreshold;

    @Value("${pricing.deal.overpriced-threshold:1.15}")
    private double overpricedThreshold;

    @Value("${pricing.deal.auction-discount:0.85}")
    private double auctionDiscount;

    @Value("${pricing.deal.exceptional-min-listings:5}")
    private int exceptionalMinListings;

    @Value("${pricing.deal.consensus-reference:AVERAGE}")
    private ConsensusReference consensusReference;

    @Value("${pricing.deal.retail-estimate.enabled:true}")
    private boolean retailEstimateEnabled;

    @Value("${pricing.deal.retail-estimate.min-multiplier:1.1}")
    private double retailMinMultiplier;

    @Value("${pricing.deal.retail-estimate.max-multiplier:1.3}")
    private double retailMaxMultiplier;

    @Value("${pricing.worker-pool-size:5}")
    private int workerPoolSize;

    @Bean
    public Clock pricingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random pricingRandom() {
        return new SecureRandom();
    }

    // ── Request gate ─────────────────────────────────────────────────────────

    @Bean
    public GateSettings gateSettings() {
        return new GateSettings(
            Duration.ofSeconds(minRequestIntervalSeconds),
            maxRequestsPerSession,
            Duration.ofSeconds(sessionRestSeconds),
            maxRetries,
            Duration.ofSeconds(rateLimitBackoffSeconds),
            Duration.ofSeconds(errorBackoffSeconds),
            Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public RequestGate requestGate(WebClient pricingWebClient, GateSettings gateSettings,
                                   Clock pricingClock, Random pricingRandom) {
        return new RequestGate(pricingWebClient, gateSettings, pricingClock, pricingRandom);
    }

    // ── Cache namespaces ─────────────────────────────────────────────────────

    @Bean
    public JsonFileCacheStore<ConsensusResult> consensusCache(ObjectMapper objectMapper, Clock pricingClock) {
        return new JsonFileCacheStore<>("consensus", Path.of(cacheDir, "consensus_cache.json"),
            Duration.ofDays(consensusTtlDays), ConsensusResult.class, objectMapper, pricingClock);
    }

    @Bean
    public JsonFileCacheStore<Observation> scrapeCache(ObjectMapper objectMapper, Clock pricingClock) {
        return new JsonFileCacheStore<>("scrape", Path.of(cacheDir, "scrape_cache.json"),
            Duration.ofHours(scrapeTtlHours), Observation.class, objectMapper, pricingClock);
    }

    // ── Source families ──────────────────────────────────────────────────────

    @Bean
    public FallbackOrchestrator fallbackOrchestrator(RequestGate requestGate,
                                                     JsonFileCacheStore<Observation> scrapeCache,
                                                     ObjectMapper objectMapper,
                                                     Clock pricingClock,
                                                     Random pricingRandom) {
        return new FallbackOrchestrator(
            sourceFamilyChains(requestGate, scrapeCache, objectMapper, pricingClock, pricingRandom));
    }

    List<SourceFamilyChain> sourceFamilyChains(RequestGate requestGate,
                                               JsonFileCacheStore<Observation> scrapeCache,
                                               ObjectMapper objectMapper,
                                               Clock pricingClock,
                                               Random pricingRandom) {
        ScrapeSettings scrapeSettings = new ScrapeSettings(scrapeMaxPages, scrapePageSize, scrapeTargetResults);
        List<SourceFamilyChain> chains = new ArrayList<>();
        for (String family : families) {
            switch (family.trim().toLowerCase(Locale.ROOT)) {
                case "reverb" -> chains.add(SourceFamilyChain.of(ReverbApiAdapter.FAMILY,
                    new ReverbApiAdapter(requestGate, objectMapper, reverbApiToken, useSandbox, pricingClock),
                    new ReverbScrapeAdapter(requestGate, scrapeCache, scrapeSettings, pricingClock),
                    new SimulatedPriceAdapter(ReverbApiAdapter.FAMILY, 1.0, 1.0, pricingRandom, pricingClock)));
                case "ebay" -> chains.add(SourceFamilyChain.of(EbayApiAdapter.FAMILY,
                    new EbayApiAdapter(requestGate, objectMapper, ebayApiToken, useSandbox, pricingClock),
                    new EbayScrapeAdapter(requestGate, scrapeCache, scrapeSettings, pricingClock),
                    new SimulatedPriceAdapter(EbayApiAdapter.FAMILY, 0.85, 0.95, pricingRandom, pricingClock)));
                default -> throw new IllegalStateException("Unknown source family in pricing.families: " + family);
            }
        }
        log.info("SOURCE_FAMILIES families={} sandbox={} reverbToken={} ebayToken={}",
                 String.join(",", families), useSandbox, !reverbApiToken.isBlank(), !ebayApiToken.isBlank());
        return chains;
    }

    // ── Fusion and scoring ───────────────────────────────────────────────────

    @Bean
    public ConsensusEngine consensusEngine() {
        return new ConfidenceWeightedConsensusStrategy(simulatedPolicy, fillerThreshold);
    }

    @Bean
    public RatioDealScoringStrategy ratioDealScoringStrategy() {
        return new RatioDealScoringStrategy(dealThreshold, overpricedThreshold, consensusReference);
    }

    @Bean
    public SavingsPercentDealScoringStrategy savingsPercentDealScoringStrategy() {
        return new SavingsPercentDealScoringStrategy(exceptionalMinListings, consensusReference);
    }

    @Bean
    public OptimalBidCalculator optimalBidCalculator() {
        return new OptimalBidCalculator(auctionDiscount);
    }

    // ── Services ─────────────────────────────────────────────────────────────

    @Bean
    public MarketPriceService marketPriceService(FallbackOrchestrator fallbackOrchestrator,
                                                 ConsensusEngine consensusEngine,
                                                 JsonFileCacheStore<ConsensusResult> consensusCache,
                                                 Clock pricingClock) {
        return new MarketPriceService(fallbackOrchestrator, consensusEngine, consensusCache,
            pricingClock, workerPoolSize);
    }

    @Bean
    public DealScoringService dealScoringService(MarketPriceService marketPriceService,
                                                 List<DealScoringStrategy> strategies,
                                                 OptimalBidCalculator optimalBidCalculator,
                                                 Clock pricingClock,
                                                 Random pricingRandom) {
        SimulatedPriceAdapter retailEstimator = retailEstimateEnabled
            ? new SimulatedPriceAdapter(RETAIL_FAMILY, retailMinMultiplier, retailMaxMultiplier,
                                        pricingRandom, pricingClock)
            : null;
        log.info("DEAL_SCORING consensusReference={} retailEstimate={}",
                 consensusReference, retailEstimateEnabled ? RETAIL_FAMILY : "off");
        return new DealScoringService(marketPriceService, strategies, optimalBidCalculator, retailEstimator);
    }
}
