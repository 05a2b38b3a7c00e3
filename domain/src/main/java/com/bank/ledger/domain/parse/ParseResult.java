package com.bank.ledger.domain.parse;

import com.bank.ledger.domain.model.ParsedTrade;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a parsed trade or the reason the record was rejected
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParseResult {
    ParsedTrade trade;
    String error;

    public static ParseResult success(ParsedTrade trade) {
        return new ParseResult(trade, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return trade != null;
    }
}
