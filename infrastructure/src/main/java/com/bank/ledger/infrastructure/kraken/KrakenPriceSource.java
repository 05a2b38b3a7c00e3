package com.bank.ledger.infrastructure.kraken;

import com.bank.ledger.domain.enums.PriceMode;
import com.bank.ledger.domain.source.PriceSource;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeSet;

import static com.bank.ledger.domain.util.DecimalUtils.safeDivide;
import static com.bank.ledger.domain.util.DecimalUtils.toDecimal;

/**
 * Current prices from Kraken's public Ticker endpoint, one call for all pairs.
 * Any failure leaves the prices absent, which the report shows as "no price".
 */
public class KrakenPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(KrakenPriceSource.class);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final KrakenApiClient client;
    private final PriceMode priceMode;

    public KrakenPriceSource(KrakenApiClient client, PriceMode priceMode) {
        this.client = client;
        this.priceMode = priceMode;
    }

    @Override
    public Map<String, BigDecimal> fetchPrices(Collection<String> pairIdentifiers) {
        if (pairIdentifiers.isEmpty()) {
            return Map.of();
        }
        String joined = String.join(",", new TreeSet<>(pairIdentifiers));

        JsonNode response;
        try {
            response = client.queryPublic("Ticker", Map.of("pair", joined));
        } catch (KrakenApiException | CallNotPermittedException e) {
            log.warn("Ticker unavailable, reporting without prices: {}", e.getMessage());
            return Map.of();
        }
        if (!KrakenApiClient.errors(response).isEmpty()) {
            log.warn("Ticker error for {}: {}", joined, KrakenApiClient.errors(response));
            return Map.of();
        }

        Map<String, BigDecimal> prices = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> tickers = response.path("result").fields();
        while (tickers.hasNext()) {
            Map.Entry<String, JsonNode> ticker = tickers.next();
            try {
                prices.put(ticker.getKey(), priceOf(ticker.getValue()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable ticker for {}: {}", ticker.getKey(), e.getMessage());
            }
        }
        log.info("Fetched {} prices ({} mode)", prices.size(), priceMode);
        return prices;
    }

    private BigDecimal priceOf(JsonNode ticker) {
        return switch (priceMode) {
            case LAST -> toDecimal(first(ticker, "c"));
            case MID -> safeDivide(toDecimal(first(ticker, "b")).add(toDecimal(first(ticker, "a"))), TWO);
        };
    }

    private static String first(JsonNode ticker, String field) {
        JsonNode values = ticker.path(field);
        return values.isArray() && values.size() > 0 ? values.get(0).asText() : "0";
    }
}
