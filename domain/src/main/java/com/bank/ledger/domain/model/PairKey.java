package com.bank.ledger.domain.model;

import lombok.Value;

import java.util.Comparator;

/**
 * (base, quote) symbol pair identifying one ledger
 */
@Value
public class PairKey implements Comparable<PairKey> {

    private static final Comparator<PairKey> ORDER = Comparator
            .comparing(PairKey::getBase)
            .thenComparing(PairKey::getQuote);

    String base;
    String quote;

    public static PairKey of(String base, String quote) {
        return new PairKey(normalize(base), normalize(quote));
    }

    /**
     * Parse the "BASE/QUOTE" display form
     */
    public static PairKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Pair is required");
        }
        int slash = text.indexOf('/');
        if (slash <= 0 || slash == text.length() - 1) {
            throw new IllegalArgumentException("Pair must be in format BASE/QUOTE: " + text);
        }
        return of(text.substring(0, slash), text.substring(slash + 1));
    }

    /**
     * Empty base or quote means the identifier could not be split reliably
     */
    public boolean isSuspect() {
        return base.isEmpty() || quote.isEmpty();
    }

    @Override
    public int compareTo(PairKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return base + "/" + quote;
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase();
    }
}
