package com.bank.ledger.domain.enums;

import java.util.Optional;

/**
 * Direction of a trade
 */
public enum TradeSide {
    BUY,
    SELL;

    /**
     * Case-insensitive lookup, empty for anything other than buy or sell
     */
    public static Optional<TradeSide> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return switch (text.trim().toLowerCase()) {
            case "buy" -> Optional.of(BUY);
            case "sell" -> Optional.of(SELL);
            default -> Optional.empty();
        };
    }
}
