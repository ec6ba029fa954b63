package com.gearprice.marketdata.controller;

import com.gearprice.common.model.ConsensusResult;
import com.gearprice.common.model.DealAssessment;
import com.gearprice.common.model.DealScheme;
import com.gearprice.marketdata.service.DealScoringService;
import com.gearprice.marketdata.service.MarketPriceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-price")
public class MarketPriceController {

    private static final Logger log = LoggerFactory.getLogger(MarketPriceController.class);

    private final MarketPriceService marketPriceService;
    private final DealScoringService dealScoringService;

    public MarketPriceController(MarketPriceService marketPriceService, DealScoringService dealScoringService) {
        this.marketPriceService = marketPriceService;
        this.dealScoringService = dealScoringService;
    }

    @GetMapping("/consensus")
    public Mono<ResponseEntity<ConsensusResult>> consensus(@RequestParam("q") String query,
                                                           @RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
        return marketPriceService.getMarketPrice(query, refresh)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(errorResponse("consensus", query, e)));
    }

    @GetMapping("/deal")
    public Mono<ResponseEntity<DealAssessment>> deal(@RequestParam("q") String query,
                                                     @RequestParam("referencePrice") double referencePrice,
                                                     @RequestParam(name = "retailPrice", required = false) Double retailPrice,
                                                     @RequestParam(name = "scheme", defaultValue = "RATIO") DealScheme scheme) {
        return dealScoringService.assess(query, referencePrice, retailPrice, scheme)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(errorResponse("deal", query, e)));
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Map<String, Object>>> invalidate(@RequestParam("q") String query) {
        return marketPriceService.invalidate(query)
            .map(removed -> ResponseEntity.ok(Map.<String, Object>of("query", query, "removed", removed)))
            .onErrorResume(e -> Mono.just(errorResponse("invalidate", query, e)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> ResponseEntity<T> errorResponse(String operation, String query, Throwable e) {
        if (e instanceof IllegalArgumentException) {
            log.warn("BAD_REQUEST operation={} query={} reason={}", operation, query, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
        log.error("REQUEST_FAILED operation={} query={}", operation, query, e);
        return ResponseEntity.internalServerError().build();
    }
}
