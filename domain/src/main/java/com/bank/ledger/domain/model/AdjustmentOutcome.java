package com.bank.ledger.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdjustmentOutcome {
    String base;
    String quote;
    String previousVolume;
    String targetVolume;
    String removedVolume;
}
