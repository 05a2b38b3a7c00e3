package com.bank.ledger.domain.source;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Supplies current market prices
 */
public interface PriceSource {

    /**
     * @param pairIdentifiers raw identifiers as they appear in trade records
     * @return price per identifier; identifiers without a price are absent
     */
    Map<String, BigDecimal> fetchPrices(Collection<String> pairIdentifiers);
}
