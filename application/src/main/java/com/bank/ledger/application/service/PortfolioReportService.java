package com.bank.ledger.application.service;

import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.model.AdjustableEntry;
import com.bank.ledger.domain.model.AdjustmentOutcome;
import com.bank.ledger.domain.model.AdjustmentRequest;
import com.bank.ledger.domain.model.BookingSummary;
import com.bank.ledger.domain.model.LedgerBook;
import com.bank.ledger.domain.model.LedgerSettings;
import com.bank.ledger.domain.model.PortfolioReport;
import com.bank.ledger.domain.model.ReportRow;
import com.bank.ledger.domain.parse.TradeRecordParser;
import com.bank.ledger.domain.source.PriceSource;
import com.bank.ledger.domain.source.TradeSource;
import com.bank.ledger.domain.valuation.ValuationCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Builds a report: book the trades, apply adjustments, price and value every pair.
 * Each call works on a fresh ledger book.
 */
@Service
public class PortfolioReportService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioReportService.class);

    private final TradeSource tradeSource;
    private final PriceSource priceSource;
    private final LedgerSettings settings;
    private final TradeRecordParser parser;
    private final ValuationCalculator valuationCalculator;
    private final BalanceAdjustmentService adjustmentService;

    public PortfolioReportService(TradeSource tradeSource,
                                  PriceSource priceSource,
                                  LedgerSettings settings,
                                  TradeRecordParser parser,
                                  ValuationCalculator valuationCalculator,
                                  BalanceAdjustmentService adjustmentService) {
        this.tradeSource = tradeSource;
        this.priceSource = priceSource;
        this.settings = settings;
        this.parser = parser;
        this.valuationCalculator = valuationCalculator;
        this.adjustmentService = adjustmentService;
    }

    /**
     * @param trades records in chronological order
     * @param prices prices by pair identifier; null fetches them from the configured price source
     * @param adjustments target remaining volumes, may be null
     * @throws IllegalArgumentException when an adjustment is invalid; no report is built
     */
    public PortfolioReport generate(List<TradeEvent> trades, Map<String, BigDecimal> prices,
                                    List<AdjustmentRequest> adjustments) {
        LedgerBook book = new LedgerBook(settings, parser);
        BookingSummary summary = book.applyAll(trades != null ? trades : List.of());

        List<AdjustmentOutcome> outcomes = adjustments == null || adjustments.isEmpty()
                ? List.of()
                : adjustmentService.apply(book, adjustments);

        Map<String, BigDecimal> effectivePrices = prices != null
                ? prices
                : priceSource.fetchPrices(book.getPairIdentifiers());
        List<ReportRow> rows = valuationCalculator.compute(book, effectivePrices);

        log.info("Report built: {} pairs, {} records applied, {} filtered, {} skipped, {} adjustments",
                rows.size(), summary.getAppliedCount(), summary.getFilteredCount(),
                summary.getSkippedCount(), outcomes.size());

        return PortfolioReport.builder()
                .rows(rows)
                .applied(summary.getAppliedCount())
                .filtered(summary.getFilteredCount())
                .skipped(summary.getSkipped())
                .adjustments(outcomes)
                .build();
    }

    /**
     * Report over the configured trade and price sources
     */
    public PortfolioReport generateFromSources(List<AdjustmentRequest> adjustments) {
        return generate(tradeSource.fetchTrades(), null, adjustments);
    }

    /**
     * Pairs from the configured trade source that still hold inventory
     */
    public List<AdjustableEntry> adjustableFromSources() {
        LedgerBook book = new LedgerBook(settings, parser);
        book.applyAll(tradeSource.fetchTrades());
        return adjustmentService.adjustableEntries(book);
    }
}
