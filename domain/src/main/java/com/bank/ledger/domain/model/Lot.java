package com.bank.ledger.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An acquired batch of units that has not been fully consumed yet.
 * Immutable: consuming part of a lot yields a new lot with the same id.
 */
@Value
@Builder(toBuilder = true)
public class Lot {
    String id;
    BigDecimal remainingVolume;
    BigDecimal unitCost; // Per unit, fees included when they are capitalized

    /**
     * remainingVolume * unitCost, always derived so it can never drift from the volume
     */
    public BigDecimal getTotalCost() {
        return remainingVolume.multiply(unitCost);
    }

    /**
     * Consume part of this lot
     */
    public Lot reduce(BigDecimal volume) {
        if (volume.compareTo(remainingVolume) > 0) {
            throw new IllegalArgumentException("Cannot consume more volume than remaining");
        }
        return toBuilder()
                .remainingVolume(remainingVolume.subtract(volume))
                .build();
    }

    public boolean isExhausted() {
        return remainingVolume.signum() <= 0;
    }
}
