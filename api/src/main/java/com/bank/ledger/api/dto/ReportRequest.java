package com.bank.ledger.api.dto;

import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.model.AdjustmentRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Body of POST /api/reports.
 * Without prices the configured price source is asked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRequest {
    @Builder.Default
    private List<TradeEvent> trades = new ArrayList<>();

    private Map<String, BigDecimal> prices;

    @Builder.Default
    private List<AdjustmentRequest> adjustments = new ArrayList<>();
}
