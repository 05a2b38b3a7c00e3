package com.bank.ledger.domain.event;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TradeChronologyTest {

    @Test
    void testSortsNewestFirstHistoryIntoChronologicalOrder() {
        List<TradeEvent> sorted = TradeChronology.oldestFirst(List.of(
                TradeEvent.builder().tradeId("C").time("1700000300.25").build(),
                TradeEvent.builder().tradeId("B").time("1700000200").build(),
                TradeEvent.builder().tradeId("X").time("not-a-time").build(),
                TradeEvent.builder().tradeId("A").time("1700000100.9").build()));

        assertEquals(List.of("X", "A", "B", "C"), sorted.stream().map(TradeEvent::getTradeId).collect(Collectors.toList()));
    }

    @Test
    void testEqualTimesKeepSourceOrder() {
        List<TradeEvent> sorted = TradeChronology.oldestFirst(List.of(
                TradeEvent.builder().tradeId("first").time("5").build(),
                TradeEvent.builder().tradeId("second").time("5.0").build()));

        assertEquals("first", sorted.get(0).getTradeId());
    }
}
