package com.bank.ledger.infrastructure.config;

import com.bank.ledger.domain.enums.PriceMode;
import com.bank.ledger.infrastructure.kraken.KrakenApiClient;
import com.bank.ledger.infrastructure.kraken.KrakenPriceSource;
import com.bank.ledger.infrastructure.kraken.KrakenTradeSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Kraken adapters.
 * Keys come from the environment; use a query-only API key.
 *
 * Configuration in application.yml:
 *   kraken:
 *     api:
 *       base-url: https://api.kraken.com
 *       key: ${KRAKEN_KEY:}
 *       secret: ${KRAKEN_SECRET:}
 *       page-delay-ms: 800
 */
@Configuration
public class KrakenConfig {

    private static final Logger log = LoggerFactory.getLogger(KrakenConfig.class);

    @Value("${kraken.api.base-url:https://api.kraken.com}")
    private String baseUrl;

    @Value("${kraken.api.key:}")
    private String apiKey;

    @Value("${kraken.api.secret:}")
    private String apiSecret;

    @Value("${kraken.api.page-delay-ms:800}")
    private long pageDelayMs;

    @Value("${kraken.api.timeout-ms:15000}")
    private int timeoutMs;

    @Value("${app.price.mode:last}")
    private String priceMode;

    @Bean
    public RestTemplate krakenRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return new RestTemplate(requestFactory);
    }

    @Bean
    public KrakenApiClient krakenApiClient(@Qualifier("krakenRestTemplate") RestTemplate restTemplate,
                                           ObjectMapper objectMapper,
                                           @Qualifier("krakenPrivateRetry") Retry privateRetry,
                                           @Qualifier("krakenPublicCircuitBreaker") CircuitBreaker publicCircuitBreaker) {
        KrakenApiClient client = new KrakenApiClient(restTemplate, objectMapper, baseUrl, apiKey, apiSecret,
                privateRetry, publicCircuitBreaker);
        if (!client.hasCredentials()) {
            log.info("No Kraken API credentials configured; only public endpoints are usable");
        }
        return client;
    }

    @Bean("krakenTradeSource")
    public KrakenTradeSource krakenTradeSource(KrakenApiClient client, ObjectMapper objectMapper) {
        return new KrakenTradeSource(client, objectMapper, Duration.ofMillis(pageDelayMs));
    }

    @Bean("krakenPriceSource")
    public KrakenPriceSource krakenPriceSource(KrakenApiClient client) {
        return new KrakenPriceSource(client, PriceMode.valueOf(priceMode.trim().toUpperCase()));
    }
}
