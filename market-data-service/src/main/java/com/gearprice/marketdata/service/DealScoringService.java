package com.gearprice.marketdata.service;

import com.gearprice.common.deal.DealScoringStrategy;
import com.gearprice.common.deal.OptimalBidCalculator;
import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.DealAssessment;
import com.gearprice.common.model.DealScheme;
import com.gearprice.common.model.Observation;
import com.gearprice.common.query.QueryNormalizer;
import com.gearprice.marketdata.source.PriceSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a reference price against the market consensus for an item and attaches
 * the optimal target bid.
 *
 * <p>When the caller gives no retail price and a retail estimator is configured,
 * the estimate is blended into the target bid instead.
 */
public class DealScoringService {

    private static final Logger log = LoggerFactory.getLogger(DealScoringService.class);

    private final MarketPriceService marketPriceService;
    private final Map<DealScheme, DealScoringStrategy> strategies;
    private final OptimalBidCalculator bidCalculator;
    private final PriceSourceAdapter retailEstimator;

    public DealScoringService(MarketPriceService marketPriceService,
                              List<DealScoringStrategy> strategies,
                              OptimalBidCalculator bidCalculator) {
        this(marketPriceService, strategies, bidCalculator, null);
    }

    /**
     * @param retailEstimator source of a retail price when the caller has none; may be null
     */
    public DealScoringService(MarketPriceService marketPriceService,
                              List<DealScoringStrategy> strategies,
                              OptimalBidCalculator bidCalculator,
                              PriceSourceAdapter retailEstimator) {
        this.marketPriceService = marketPriceService;
        this.strategies         = new EnumMap<>(DealScheme.class);
        for (DealScoringStrategy strategy : strategies) {
            this.strategies.put(strategy.scheme(), strategy);
        }
        this.bidCalculator      = bidCalculator;
        this.retailEstimator    = retailEstimator;
    }

    /**
     * @param referencePrice positive price being judged
     * @param retailPrice    optional retail price blended into the target bid
     * @param scheme         scoring scheme; must have a registered strategy
     */
    public Mono<DealAssessment> assess(String description, double referencePrice,
                                       Double retailPrice, DealScheme scheme) {
        if (!(referencePrice > 0.0)) {
            return Mono.error(new IllegalArgumentException("referencePrice must be positive: " + referencePrice));
        }
        if (retailPrice != null && !(retailPrice > 0.0)) {
            return Mono.error(new IllegalArgumentException("retailPrice must be positive when given: " + retailPrice));
        }
        DealScoringStrategy strategy = strategies.get(scheme);
        if (strategy == null) {
            return Mono.error(new IllegalArgumentException("No scoring strategy for scheme " + scheme));
        }

        Mono<DealAssessment> assessed;
        if (retailPrice != null || retailEstimator == null) {
            String retailFrom = retailPrice != null ? DealAssessment.RETAIL_FROM_CALLER : null;
            assessed = marketPriceService.getMarketPrice(description)
                .map(consensus -> score(strategy, referencePrice, retailPrice, retailFrom, consensus));
        } else {
            assessed = marketPriceService.getMarketPrice(description)
                .flatMap(consensus -> estimateRetail(description)
                    .map(estimate -> score(strategy, referencePrice, estimate.price(), estimate.sourceType(), consensus))
                    .switchIfEmpty(Mono.fromSupplier(() -> score(strategy, referencePrice, null, null, consensus))));
        }
        return assessed
            .doOnNext(a -> log.info("DEAL_ASSESSED query={} scheme={} reference={} consensus={} score={} category={} target={} retail={} retailSource={}",
                                    description, a.scheme(), a.referencePrice(), a.consensusPrice(),
                                    a.dealScore(), a.category(), a.targetPrice(), a.retailPrice(), a.retailSource()));
    }

    private Mono<Observation> estimateRetail(String description) {
        return retailEstimator.fetch(QueryNormalizer.normalize(description))
            .doOnNext(o -> log.debug("RETAIL_ESTIMATED query={} source={} price={}",
                                     description, o.sourceType(), o.price()))
            .onErrorResume(e -> {
                log.warn("RETAIL_ESTIMATE_FAILED query={} error={}", description, e.getMessage());
                return Mono.empty();
            });
    }

    DealAssessment score(DealScoringStrategy strategy, double referencePrice,
                         Double retailPrice, String retailFrom, ConsensusResult consensus) {
        DealAssessment assessment = strategy.assess(referencePrice, consensus);
        Double target = bidCalculator.targetPrice(assessment.consensusPrice(), retailPrice,
            consensus.confidenceLevel(), consensus.conditionCounts());
        return assessment.withTarget(target, retailPrice, retailFrom);
    }
}
