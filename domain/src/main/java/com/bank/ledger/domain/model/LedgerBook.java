package com.bank.ledger.domain.model;

import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.parse.ParseResult;
import com.bank.ledger.domain.parse.TradeRecordParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One {@link PairLedger} per (base, quote) pair.
 * Records are applied strictly in the order given: a sell only matches buys that were
 * applied before it.
 */
public class LedgerBook {

    private static final Logger log = LoggerFactory.getLogger(LedgerBook.class);

    private final LedgerSettings settings;
    private final TradeRecordParser parser;
    private final Map<PairKey, PairLedger> ledgers = new HashMap<>();

    public LedgerBook(LedgerSettings settings, TradeRecordParser parser) {
        this.settings = settings;
        this.parser = parser;
    }

    /**
     * Apply a batch in order. Malformed records are skipped and reported, records whose
     * quote is not allowed are dropped; neither stops the batch.
     */
    public BookingSummary applyAll(List<TradeEvent> events) {
        BookingSummary summary = new BookingSummary();
        for (int i = 0; i < events.size(); i++) {
            TradeEvent event = events.get(i);
            ParseResult parsed = parser.parse(i, event);
            if (!parsed.isSuccess()) {
                String tradeId = event != null ? event.getTradeId() : null;
                log.warn("Skipping trade record #{} ({}): {}", i, tradeId, parsed.getError());
                summary.getSkipped().add(BookingSummary.SkippedRecord.builder()
                        .index(i)
                        .tradeId(tradeId)
                        .reason(parsed.getError())
                        .build());
                continue;
            }
            if (apply(parsed.getTrade())) {
                summary.setAppliedCount(summary.getAppliedCount() + 1);
            } else {
                summary.setFilteredCount(summary.getFilteredCount() + 1);
            }
        }
        log.info("Applied {} trades to {} ledgers ({} filtered by quote, {} skipped)",
                summary.getAppliedCount(), ledgers.size(), summary.getFilteredCount(), summary.getSkippedCount());
        return summary;
    }

    /**
     * Route one parsed trade to its ledger
     *
     * @return false if the quote filter dropped it
     */
    public boolean apply(ParsedTrade trade) {
        PairKey key = trade.getPairKey();
        if (!settings.acceptsQuote(key.getQuote())) {
            return false;
        }
        if (key.isSuspect()) {
            log.warn("Pair identifier {} could not be split reliably, booked as {}", trade.getPairIdentifier(), key);
        }

        PairLedger ledger = ledgers.computeIfAbsent(key, PairLedger::new);
        ledger.recordObservation(trade.getPairIdentifier(), trade.getTimestamp());

        switch (trade.getSide()) {
            case BUY -> ledger.applyBuy(trade.getVolume(), trade.getPrice(), trade.getCost(), trade.getFee(),
                    settings.isIncludeFeesInCost());
            case SELL -> ledger.applySell(trade.getVolume(), trade.getPrice(), trade.getCost(), trade.getFee(),
                    settings.isIncludeFeesInCost());
        }
        return true;
    }

    public Optional<PairLedger> getLedger(PairKey key) {
        return Optional.ofNullable(ledgers.get(key));
    }

    /**
     * Ledgers sorted by (base, quote)
     */
    public List<PairLedger> getLedgers() {
        List<PairLedger> sorted = new ArrayList<>(ledgers.values());
        sorted.sort((a, b) -> a.getPairKey().compareTo(b.getPairKey()));
        return sorted;
    }

    /**
     * One raw identifier per ledger, the keys a price source is asked for
     */
    public Set<String> getPairIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>();
        for (PairLedger ledger : getLedgers()) {
            if (ledger.getExamplePairIdentifier() != null) {
                identifiers.add(ledger.getExamplePairIdentifier());
            }
        }
        return identifiers;
    }

    public LedgerSettings getSettings() {
        return settings;
    }

    public int size() {
        return ledgers.size();
    }

    public boolean isEmpty() {
        return ledgers.isEmpty();
    }
}
