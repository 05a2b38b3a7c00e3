package com.bank.ledger.api.controller;

import com.bank.ledger.api.dto.ReportRequest;
import com.bank.ledger.application.service.PortfolioReportService;
import com.bank.ledger.domain.model.AdjustableEntry;
import com.bank.ledger.domain.model.PortfolioReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for trade average reports
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    private final PortfolioReportService reportService;

    public ReportController(PortfolioReportService reportService) {
        this.reportService = reportService;
    }

    /**
     * Report over the trades, prices and adjustments in the request body
     */
    @PostMapping
    public ResponseEntity<Object> createReport(@RequestBody ReportRequest request) {
        try {
            log.info("Building report for {} trades, {} adjustments",
                    request.getTrades() != null ? request.getTrades().size() : 0,
                    request.getAdjustments() != null ? request.getAdjustments().size() : 0);
            PortfolioReport report = reportService.generate(
                    request.getTrades(), request.getPrices(), request.getAdjustments());
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected report request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            log.error("Error building report", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    /**
     * Report over the configured trade and price sources
     */
    @GetMapping
    public ResponseEntity<Object> getReport() {
        try {
            return ResponseEntity.ok(reportService.generateFromSources(List.of()));
        } catch (Exception e) {
            log.error("Error building report from configured sources", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    /**
     * Pairs from the configured trade source that still hold inventory
     */
    @GetMapping("/adjustable")
    public ResponseEntity<Map<String, Object>> getAdjustable() {
        try {
            List<AdjustableEntry> entries = reportService.adjustableFromSources();
            Map<String, Object> response = new HashMap<>();
            response.put("entries", entries);
            response.put("count", entries.size());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Error listing adjustable pairs", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message != null ? message : "Unexpected error");
        return body;
    }
}
