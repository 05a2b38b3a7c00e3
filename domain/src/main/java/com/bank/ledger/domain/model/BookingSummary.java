package com.bank.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying a batch of trade records to a ledger book
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingSummary {
    private int appliedCount;
    private int filteredCount; // Dropped by the quote filter
    @Builder.Default
    private List<SkippedRecord> skipped = new ArrayList<>();

    public int getSkippedCount() {
        return skipped.size();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedRecord {
        private int index;
        private String tradeId;
        private String reason;
    }
}
