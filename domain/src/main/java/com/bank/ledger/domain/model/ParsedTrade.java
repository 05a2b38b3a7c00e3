package com.bank.ledger.domain.model;

import com.bank.ledger.domain.enums.TradeSide;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Trade record with every field converted to exact decimals and the pair resolved
 */
@Value
@Builder
public class ParsedTrade {
    int index;
    String tradeId;
    String pairIdentifier;
    PairKey pairKey;
    TradeSide side;
    BigDecimal volume;
    BigDecimal price;
    BigDecimal cost;
    BigDecimal fee;
    BigDecimal timestamp;
}
