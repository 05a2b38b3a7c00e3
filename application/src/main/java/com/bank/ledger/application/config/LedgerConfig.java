package com.bank.ledger.application.config;

import com.bank.ledger.domain.model.LedgerSettings;
import com.bank.ledger.domain.pair.PairNormalizer;
import com.bank.ledger.domain.parse.TradeRecordParser;
import com.bank.ledger.domain.valuation.ValuationCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Accounting options and the stateless domain collaborators.
 *
 * Configuration in application.yml:
 *   app:
 *     ledger:
 *       include-fees-in-cost: true
 *       only-these-quotes: USD,EUR   # empty keeps every quote
 *       pair-aliases: XBT=BTC
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Value("${app.ledger.include-fees-in-cost:true}")
    private boolean includeFeesInCost;

    @Value("${app.ledger.only-these-quotes:}")
    private String onlyTheseQuotes;

    @Value("${app.ledger.pair-aliases:XBT=BTC}")
    private String pairAliases;

    @Bean
    public LedgerSettings ledgerSettings() {
        LedgerSettings settings = LedgerSettings.builder()
                .includeFeesInCost(includeFeesInCost)
                .allowedQuotes(parseQuotes(onlyTheseQuotes))
                .build();
        log.info("Ledger settings: includeFeesInCost={}, allowedQuotes={}",
                settings.isIncludeFeesInCost(),
                settings.getAllowedQuotes().isEmpty() ? "all" : settings.getAllowedQuotes());
        return settings;
    }

    @Bean
    public PairNormalizer pairNormalizer() {
        return new PairNormalizer(parseAliases(pairAliases), PairNormalizer.DEFAULT_QUOTES);
    }

    @Bean
    public TradeRecordParser tradeRecordParser(PairNormalizer pairNormalizer) {
        return new TradeRecordParser(pairNormalizer);
    }

    @Bean
    public ValuationCalculator valuationCalculator() {
        return new ValuationCalculator();
    }

    static Set<String> parseQuotes(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toUpperCase)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * "XBT=BTC,XDG=DOGE" to an alias map
     */
    static Map<String, String> parseAliases(String text) {
        Map<String, String> aliases = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return aliases;
        }
        for (String entry : text.split(",")) {
            String[] parts = entry.split("=");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalArgumentException("Pair alias must be in format FROM=TO: " + entry.trim());
            }
            aliases.put(parts[0].trim().toUpperCase(), parts[1].trim().toUpperCase());
        }
        return aliases;
    }
}
