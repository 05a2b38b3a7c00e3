package com.bank.ledger.domain.pair;

import com.bank.ledger.domain.model.PairKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PairNormalizerTest {

    private final PairNormalizer normalizer = new PairNormalizer();

    @ParameterizedTest
    @CsvSource({
            "XXBTZUSD, BTC, USD",
            "XETHZUSD, ETH, USD",
            "ETHUSD, ETH, USD",
            "ETH/USDT, ETH, USDT",
            "XBTUSD, BTC, USD",
            "xxbtzeur, BTC, EUR",
            "XTZUSD, XTZ, USD",
            "DOTUSDC, DOT, USDC",
            "ADAETH, ADA, ETH"
    })
    void testParseKnownIdentifiers(String identifier, String base, String quote) {
        assertEquals(PairKey.of(base, quote), normalizer.parse(identifier));
    }

    @ParameterizedTest
    @CsvSource({
            "XTZUSDT, XTZ, USDT",
            "BLZUSDT, BLZ, USDT",
            "USDTZUSD, USDT, USD",
            "XXBTZUSDT, BTC, USDT"
    })
    void testZMarkerOnlySplitsLegacyIdentifiers(String identifier, String base, String quote) {
        assertEquals(PairKey.of(base, quote), normalizer.parse(identifier));
    }

    @Test
    void testEmptyIdentifierYieldsEmptyPair() {
        PairKey key = normalizer.parse("");

        assertEquals("", key.getBase());
        assertEquals("", key.getQuote());
        assertTrue(key.isSuspect());
        assertEquals(PairKey.of("", ""), normalizer.parse(null));
    }

    @Test
    void testUnknownQuoteFallsBackToTrailingFourCharacters() {
        assertEquals(PairKey.of("AB", "CDEF"), normalizer.parse("ABCDEF"));
    }

    @Test
    void testShortIdentifierFallsBackToTrailingThreeCharacters() {
        assertEquals(PairKey.of("A", "BCD"), normalizer.parse("ABCD"));
    }

    @Test
    void testIdentifierTooShortToSplitHasEmptyQuote() {
        PairKey key = normalizer.parse("ABC");

        assertEquals(PairKey.of("ABC", ""), key);
        assertTrue(key.isSuspect());
    }

    @Test
    void testCustomAliases() {
        PairNormalizer custom = new PairNormalizer(Map.of("XBT", "BTC", "XDG", "DOGE"), PairNormalizer.DEFAULT_QUOTES);

        assertEquals(PairKey.of("DOGE", "USD"), custom.parse("XDGUSD"));
    }

    @Test
    void testNormalizeStripsSeparators() {
        PairNormalizer custom = new PairNormalizer(Map.of(), Set.of("USD"));

        assertEquals("ETHUSD", custom.normalize("eth-usd"));
        assertEquals("XBTUSD", custom.normalize("XBT/USD"));
    }
}
