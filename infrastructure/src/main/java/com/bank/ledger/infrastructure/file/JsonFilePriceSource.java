package com.bank.ledger.infrastructure.file;

import com.bank.ledger.domain.source.PriceSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import static com.bank.ledger.domain.util.DecimalUtils.toDecimal;

/**
 * Prices from a JSON object of pair identifier to price, e.g. {"XXBTZUSD": "64000.1"}.
 * A missing file means no prices.
 */
public class JsonFilePriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePriceSource.class);

    private final ObjectMapper objectMapper;
    private final Path path;

    public JsonFilePriceSource(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public Map<String, BigDecimal> fetchPrices(Collection<String> pairIdentifiers) {
        if (path == null || !Files.exists(path)) {
            log.warn("Price file {} not found, reporting without prices", path);
            return Map.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read prices from " + path, e);
        }

        Map<String, BigDecimal> prices = new HashMap<>();
        for (String identifier : pairIdentifiers) {
            JsonNode price = root.get(identifier);
            if (price == null || price.isNull()) {
                continue;
            }
            try {
                prices.put(identifier, toDecimal(price.asText()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable price for {}: {}", identifier, price);
            }
        }
        return prices;
    }
}
