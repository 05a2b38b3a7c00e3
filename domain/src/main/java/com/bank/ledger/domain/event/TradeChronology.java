package com.bank.ledger.domain.event;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders trade records by their time field, oldest first.
 * The sort is stable and a missing or unreadable time sorts as zero.
 */
public final class TradeChronology {

    private TradeChronology() {
    }

    public static List<TradeEvent> oldestFirst(List<TradeEvent> events) {
        List<TradeEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(TradeChronology::timeOf));
        return sorted;
    }

    private static BigDecimal timeOf(TradeEvent event) {
        if (event == null || event.getTime() == null || event.getTime().isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(event.getTime().trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
