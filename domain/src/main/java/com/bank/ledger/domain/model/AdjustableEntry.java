package com.bank.ledger.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A pair that still holds inventory and can be adjusted, numbered from 1
 */
@Value
@Builder
public class AdjustableEntry {
    int index;
    String base;
    String quote;
    String remainingVolume;
}
