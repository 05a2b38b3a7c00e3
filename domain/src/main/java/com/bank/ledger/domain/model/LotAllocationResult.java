package com.bank.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks which lots a sell or a shrink consumed, for logging and audit
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotAllocationResult {
    @Builder.Default
    private List<LotAllocation> allocations = new ArrayList<>();

    /**
     * Volume that could not be matched against open lots (oversell)
     */
    @Builder.Default
    private BigDecimal unmatchedVolume = BigDecimal.ZERO;

    public void addAllocation(String lotId, BigDecimal volume, BigDecimal unitCost, BigDecimal realizedPnl) {
        allocations.add(LotAllocation.builder()
                .lotId(lotId)
                .volume(volume)
                .unitCost(unitCost)
                .realizedPnl(realizedPnl)
                .build());
    }

    public BigDecimal getMatchedVolume() {
        return allocations.stream()
                .map(LotAllocation::getVolume)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalRealizedPnl() {
        return allocations.stream()
                .filter(a -> a.getRealizedPnl() != null)
                .map(LotAllocation::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean hasUnmatchedVolume() {
        return unmatchedVolume.signum() > 0;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LotAllocation {
        private String lotId;
        private BigDecimal volume;
        private BigDecimal unitCost;
        private BigDecimal realizedPnl; // null for shrinks, which realize nothing
    }
}
