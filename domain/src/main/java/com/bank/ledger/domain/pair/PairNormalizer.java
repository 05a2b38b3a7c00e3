package com.bank.ledger.domain.pair;

import com.bank.ledger.domain.model.PairKey;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps exchange instrument identifiers ("XXBTZUSD", "XETHZUSD", "ETHUSD", "ETH/USDT")
 * to a (base, quote) pair.
 * <p>
 * Legacy Kraken identifiers carry an X prefix on the base asset and a Z marker before
 * the quote, e.g. XXBTZUSD or USDTZUSD. Everything else is split by looking for a known quote symbol at the end,
 * then by assuming a 4 or 3 character quote. The result is best effort: an empty base
 * or quote marks an identifier that could not be split.
 */
public class PairNormalizer {

    public static final Map<String, String> DEFAULT_ALIASES = Map.of("XBT", "BTC");

    public static final Set<String> DEFAULT_QUOTES = Set.of(
            "USDT", "USDC", "DAI", "USD", "EUR", "GBP", "JPY", "CAD", "CHF", "AUD", "BTC", "ETH");

    private static final char QUOTE_MARKER = 'Z';
    private static final char BASE_PREFIX = 'X';
    private static final int MIN_LEGACY_LENGTH = 7;
    private static final int LEGACY_BASE_LENGTH = 4;
    private static final String SEPARATORS = "[/\\-_\\s]";

    private final Map<String, String> aliases;
    private final Set<String> knownQuotes;

    public PairNormalizer() {
        this(DEFAULT_ALIASES, DEFAULT_QUOTES);
    }

    public PairNormalizer(Map<String, String> aliases, Set<String> knownQuotes) {
        this.aliases = new LinkedHashMap<>();
        aliases.forEach((legacy, canonical) ->
                this.aliases.put(legacy.trim().toUpperCase(), canonical.trim().toUpperCase()));
        this.knownQuotes = Set.copyOf(knownQuotes);
    }

    public PairKey parse(String pairIdentifier) {
        if (pairIdentifier == null || pairIdentifier.isBlank()) {
            return PairKey.of("", "");
        }
        String p = normalize(pairIdentifier);

        if (p.indexOf(QUOTE_MARKER) >= 0 && p.length() >= MIN_LEGACY_LENGTH) {
            int i = p.lastIndexOf(QUOTE_MARKER);
            String left = p.substring(0, i);
            String right = p.substring(i + 1);
            if (!left.isEmpty() && isMarkedQuote(left, right)) {
                if (left.charAt(0) == BASE_PREFIX && left.length() >= 2) {
                    left = left.substring(1);
                }
                return PairKey.of(left, right);
            }
        }

        for (int quoteLength : new int[]{4, 3}) {
            if (p.length() > quoteLength && knownQuotes.contains(p.substring(p.length() - quoteLength))) {
                return split(p, quoteLength);
            }
        }
        for (int quoteLength : new int[]{4, 3}) {
            if (p.length() > quoteLength) {
                return split(p, quoteLength);
            }
        }
        return PairKey.of(p, "");
    }

    /**
     * Strip separators, uppercase and replace legacy tickers with their common form
     */
    String normalize(String pairIdentifier) {
        String p = pairIdentifier.replaceAll(SEPARATORS, "").toUpperCase();
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            p = p.replace(alias.getKey(), alias.getValue());
        }
        return p;
    }

    /**
     * Kraken marks 3 character fiat quotes with Z. A 4 character quote after a Z only
     * counts when the base is an X-prefixed legacy code, so XTZUSDT and BLZUSDT keep
     * their Z in the base.
     */
    private static boolean isMarkedQuote(String left, String right) {
        if (right.length() == 3) {
            return true;
        }
        return right.length() == 4 && left.charAt(0) == BASE_PREFIX && left.length() >= LEGACY_BASE_LENGTH;
    }

    private static PairKey split(String p, int quoteLength) {
        int cut = p.length() - quoteLength;
        return PairKey.of(p.substring(0, cut), p.substring(cut));
    }
}
