package com.bank.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one report run produced: the rows plus what happened to the input
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioReport {
    @Builder.Default
    private List<ReportRow> rows = new ArrayList<>();

    private int applied;
    private int filtered;

    @Builder.Default
    private List<BookingSummary.SkippedRecord> skipped = new ArrayList<>();

    @Builder.Default
    private List<AdjustmentOutcome> adjustments = new ArrayList<>();
}
