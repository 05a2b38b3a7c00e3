package com.bank.ledger.application.config;

import com.bank.ledger.infrastructure.kraken.KrakenApiClient;
import com.bank.ledger.infrastructure.kraken.KrakenApiException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Resiliency configuration
 * Retry with exponential backoff for rate limited private Kraken calls,
 * circuit breaker for the public ticker
 */
@Configuration
public class ResiliencyConfig {

    private static final Logger log = LoggerFactory.getLogger(ResiliencyConfig.class);

    @Value("${kraken.retry.max-retries:8}")
    private int maxRetries;

    @Value("${kraken.retry.base-backoff-ms:800}")
    private long baseBackoffMs;

    @Value("${kraken.retry.jitter:0.35}")
    private double jitter;

    /**
     * Circuit breaker registry
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Retry registry
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Retry for private (signed) Kraken calls.
     * A rate limit arrives as a normal response with an error entry, so results are retried too;
     * once attempts run out the last response is handed back.
     */
    @Bean("krakenPrivateRetry")
    public Retry krakenPrivateRetry(RetryRegistry registry) {
        RetryConfig config = RetryConfig.<JsonNode>custom()
                .maxAttempts(maxRetries + 1) // First call plus retries
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(baseBackoffMs), 2.0, jitter))
                .retryOnResult(KrakenApiClient::isRateLimitError)
                .retryExceptions(ResourceAccessException.class)
                .build();

        Retry retry = registry.retry("krakenPrivate", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying Kraken private call (attempt {}), waiting {} ms",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
        return retry;
    }

    /**
     * Circuit breaker for the public Ticker endpoint
     */
    @Bean("krakenPublicCircuitBreaker")
    public CircuitBreaker krakenPublicCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(2)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(RestClientException.class, KrakenApiException.class)
                .build();

        return registry.circuitBreaker("krakenPublic", config);
    }
}
