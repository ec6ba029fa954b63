package com.gearprice.marketdata.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${pricing.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${pricing.gate.timeout-seconds:15}")
    private int responseTimeoutSeconds;

    // Sold-listing search pages run to several hundred KB.
    @Value("${pricing.http.max-in-memory-mb:4}")
    private int maxInMemoryMb;

    @Bean
    public WebClient pricingWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .followRedirect(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemoryMb * 1024 * 1024))
            .build();

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(strategies)
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {} auth={}", clientRequest.method(), clientRequest.url(),
                       clientRequest.headers().containsKey("Authorization") ? "bearer" : "none");
            return Mono.just(clientRequest);
        });
    }
}
