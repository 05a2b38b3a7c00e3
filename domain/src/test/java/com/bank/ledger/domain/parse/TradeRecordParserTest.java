package com.bank.ledger.domain.parse;

import com.bank.ledger.domain.enums.TradeSide;
import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.model.PairKey;
import com.bank.ledger.domain.model.ParsedTrade;
import com.bank.ledger.domain.pair.PairNormalizer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TradeRecordParserTest {

    private final TradeRecordParser parser = new TradeRecordParser(new PairNormalizer());

    @Test
    void testParseCompleteRecord() {
        TradeEvent event = TradeEvent.builder()
                .tradeId("TX1")
                .pair(" XXBTZUSD ")
                .side("BUY")
                .volume("0.5")
                .price("20000")
                .cost("10000.1")
                .fee("16")
                .time("1688667796.8802")
                .build();

        ParseResult result = parser.parse(3, event);

        assertTrue(result.isSuccess());
        ParsedTrade trade = result.getTrade();
        assertEquals(3, trade.getIndex());
        assertEquals("TX1", trade.getTradeId());
        assertEquals("XXBTZUSD", trade.getPairIdentifier());
        assertEquals(PairKey.of("BTC", "USD"), trade.getPairKey());
        assertEquals(TradeSide.BUY, trade.getSide());
        assertEquals(new BigDecimal("10000.1"), trade.getCost());
        assertEquals(new BigDecimal("1688667796.8802"), trade.getTimestamp());
    }

    @Test
    void testMissingCostDefaultsToVolumeTimesPrice() {
        TradeEvent event = TradeEvent.builder().pair("ETHUSD").side("sell").volume("2").price("1500.5").build();

        ParsedTrade trade = parser.parse(0, event).getTrade();

        assertEquals(0, new BigDecimal("3001").compareTo(trade.getCost()));
        assertEquals(BigDecimal.ZERO, trade.getFee());
        assertEquals(BigDecimal.ZERO, trade.getTimestamp());
    }

    @Test
    void testMalformedNumberFails() {
        TradeEvent event = TradeEvent.builder().pair("ETHUSD").side("buy").volume("1,5").price("10").build();

        ParseResult result = parser.parse(0, event);

        assertFalse(result.isSuccess());
        assertEquals("Malformed volume: 1,5", result.getError());
    }

    @Test
    void testMissingPairFails() {
        ParseResult result = parser.parse(0, TradeEvent.builder().side("buy").volume("1").build());

        assertFalse(result.isSuccess());
        assertEquals("Pair is required", result.getError());
    }

    @Test
    void testUnknownSideFails() {
        ParseResult result = parser.parse(0, TradeEvent.builder().pair("ETHUSD").side("hold").volume("1").build());

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("hold"));
    }

    @Test
    void testNegativeVolumeFails() {
        ParseResult result = parser.parse(0, TradeEvent.builder().pair("ETHUSD").side("buy").volume("-1").build());

        assertFalse(result.isSuccess());
    }

    @Test
    void testNullRecordFails() {
        assertFalse(parser.parse(0, null).isSuccess());
    }
}
