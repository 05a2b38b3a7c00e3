package com.bank.ledger.domain.source;

import com.bank.ledger.domain.event.TradeEvent;

import java.util.List;

/**
 * Supplies trade history.
 * Allows switching between the exchange API, files or any other origin.
 */
public interface TradeSource {

    /**
     * @return every trade, oldest first; malformed records are passed through unfiltered
     */
    List<TradeEvent> fetchTrades();
}
