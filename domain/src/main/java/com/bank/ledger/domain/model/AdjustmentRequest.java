package com.bank.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator supplied target remaining volume for one pair.
 * Inventory moved or sold outside the observed history is written off by shrinking
 * the pair's lots down to this target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentRequest {
    private String base;
    private String quote;
    private String targetVolume; // Textual so a bad value can be reported, usually "0"

    public PairKey pairKey() {
        return PairKey.of(base, quote);
    }
}
