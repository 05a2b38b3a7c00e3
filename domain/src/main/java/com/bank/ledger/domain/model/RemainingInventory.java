package com.bank.ledger.domain.model;

import lombok.Value;

import java.math.BigDecimal;

import static com.bank.ledger.domain.util.DecimalUtils.safeDivide;

/**
 * Volume and cost still held in open lots
 */
@Value
public class RemainingInventory {
    BigDecimal volume;
    BigDecimal cost;

    public BigDecimal getAverageCost() {
        return safeDivide(cost, volume);
    }
}
