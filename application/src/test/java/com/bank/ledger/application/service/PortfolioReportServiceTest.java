package com.bank.ledger.application.service;

import com.bank.ledger.domain.model.AdjustableEntry;
import com.bank.ledger.domain.model.LedgerSettings;
import com.bank.ledger.domain.model.PortfolioReport;
import com.bank.ledger.domain.model.ReportRow;
import com.bank.ledger.domain.pair.PairNormalizer;
import com.bank.ledger.domain.parse.TradeRecordParser;
import com.bank.ledger.domain.source.PriceSource;
import com.bank.ledger.domain.source.TradeSource;
import com.bank.ledger.domain.valuation.ValuationCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.bank.ledger.application.service.BalanceAdjustmentServiceTest.request;
import static com.bank.ledger.application.service.BalanceAdjustmentServiceTest.trade;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioReportServiceTest {

    @Mock
    private TradeSource tradeSource;

    @Mock
    private PriceSource priceSource;

    private PortfolioReportService reportService;

    @BeforeEach
    void setUp() {
        reportService = new PortfolioReportService(tradeSource, priceSource, LedgerSettings.defaults(),
                new TradeRecordParser(new PairNormalizer()), new ValuationCalculator(),
                new BalanceAdjustmentService(new AdjustmentValidationService()));
    }

    @Test
    void testReportFromSources() {
        // Given
        when(tradeSource.fetchTrades()).thenReturn(List.of(
                trade("T1", "XXBTZUSD", "buy", "1.0", "9000", "9", "1"),
                trade("T2", "XXBTZUSD", "sell", "0.4", "10000", "4", "2"),
                trade("T3", "XXBTZUSD", "hold", "1", "1", "0", "3")));
        when(priceSource.fetchPrices(Set.of("XXBTZUSD"))).thenReturn(Map.of("XXBTZUSD", new BigDecimal("10000")));

        // When
        PortfolioReport report = reportService.generateFromSources(null);

        // Then
        assertEquals(2, report.getApplied());
        assertEquals(0, report.getFiltered());
        assertEquals(1, report.getSkipped().size());
        assertEquals("T3", report.getSkipped().get(0).getTradeId());
        ReportRow btc = report.getRows().get(0);
        assertEquals("392.4", btc.getRealizedPnl());
        assertEquals("594.6", btc.getUnrealizedPnl());
        assertTrue(report.getAdjustments().isEmpty());
    }

    @Test
    void testSuppliedPricesSkipThePriceSource() {
        PortfolioReport report = reportService.generate(
                List.of(trade("T1", "ETHUSD", "buy", "2", "1500", "0", "1")),
                Map.of("ETHUSD", new BigDecimal("1600")),
                List.of(request("ETH", "USD", "0.5")));

        ReportRow eth = report.getRows().get(0);
        assertEquals("0.5", eth.getRemainingUnsoldVolume());
        assertEquals("50", eth.getUnrealizedPnl());
        assertEquals("2", eth.getTotalBought());
        assertEquals("1.5", report.getAdjustments().get(0).getRemovedVolume());
        verify(priceSource, never()).fetchPrices(any());
    }

    @Test
    void testInvalidAdjustmentFailsTheReport() {
        assertThrows(IllegalArgumentException.class, () -> reportService.generate(
                List.of(trade("T1", "ETHUSD", "buy", "2", "1500", "0", "1")),
                Map.of(),
                List.of(request("ETH", "USD", "-1"))));
    }

    @Test
    void testAdjustableFromSources() {
        when(tradeSource.fetchTrades()).thenReturn(List.of(
                trade("T1", "ETHUSD", "buy", "2", "1500", "0", "1"),
                trade("T2", "XXBTZUSD", "buy", "1", "100", "0", "2"),
                trade("T3", "XXBTZUSD", "sell", "1", "120", "0", "3")));

        List<AdjustableEntry> entries = reportService.adjustableFromSources();

        assertEquals(1, entries.size());
        assertEquals("ETH", entries.get(0).getBase());
        assertEquals("2", entries.get(0).getRemainingVolume());
    }
}
