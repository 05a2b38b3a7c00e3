package com.bank.ledger.domain.enums;

/**
 * Which ticker figure is used as the current price
 */
public enum PriceMode {
    LAST, // Last traded price
    MID   // (best bid + best ask) / 2
}
