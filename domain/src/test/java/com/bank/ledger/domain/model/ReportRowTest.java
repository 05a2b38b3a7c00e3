package com.bank.ledger.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReportRowTest {

    @Test
    void testColumnsCannotBeModified() {
        assertThrows(UnsupportedOperationException.class, () -> ReportRow.COLUMNS.set(0, "pair"));
        assertThrows(UnsupportedOperationException.class, () -> ReportRow.COLUMNS.add("extra"));
        assertEquals("asset", ReportRow.COLUMNS.get(0));
    }

    @Test
    void testValuesFollowColumnOrder() {
        // Given
        ReportRow row = ReportRow.builder()
                .asset("BTC").quote("USD")
                .totalBought("2").avgBuyPrice("100")
                .totalSold("1").avgSellPrice("150")
                .netFromHistory("1").remainingUnsoldVolume("1").avgBuyPriceOfRemaining("100")
                .feesTotal("0.5").realizedPnl("50")
                .currentPrice("200").unrealizedPnl("100")
                .build();

        // When
        String[] values = row.values();

        // Then
        assertEquals(ReportRow.COLUMNS.size(), values.length);
        assertEquals("BTC", values[ReportRow.COLUMNS.indexOf("asset")]);
        assertEquals("0.5", values[ReportRow.COLUMNS.indexOf("fees_total")]);
        assertEquals("100", values[ReportRow.COLUMNS.indexOf("unrealized_pnl")]);
    }

    @Test
    void testValuesReturnsFreshArray() {
        ReportRow row = ReportRow.builder().asset("ETH").quote("EUR").build();

        row.values()[0] = "changed";

        assertEquals("ETH", row.values()[0]);
    }
}
