package com.bank.ledger.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Accounting options fixed for the lifetime of a ledger book
 */
@Value
@Builder
public class LedgerSettings {

    /**
     * When true buy cost includes fees and sell proceeds are net of fees
     */
    @Builder.Default
    boolean includeFeesInCost = true;

    /**
     * Quote currencies to keep; empty keeps all
     */
    @Builder.Default
    Set<String> allowedQuotes = Set.of();

    public static LedgerSettings defaults() {
        return LedgerSettings.builder().build();
    }

    public boolean acceptsQuote(String quote) {
        return allowedQuotes.isEmpty() || allowedQuotes.contains(quote);
    }
}
