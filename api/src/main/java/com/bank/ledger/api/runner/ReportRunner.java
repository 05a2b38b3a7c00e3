package com.bank.ledger.api.runner;

import com.bank.ledger.application.service.BalanceAdjustmentService;
import com.bank.ledger.application.service.CorrelationIdService;
import com.bank.ledger.application.service.PortfolioReportService;
import com.bank.ledger.domain.model.AdjustmentRequest;
import com.bank.ledger.domain.model.PortfolioReport;
import com.bank.ledger.infrastructure.export.ConsoleTableRenderer;
import com.bank.ledger.infrastructure.export.CsvReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * One-shot batch run at startup: fetch trades, book them, apply the configured
 * adjustments, price, then print the table and write the CSV.
 *
 * Configuration in application.yml:
 *   app:
 *     runner:
 *       enabled: true
 *       csv-out: kraken_trade_averages.csv
 *       adjustments: BTC/USD=0,ETH/USD=1.5
 */
@Component
@ConditionalOnProperty(name = "app.runner.enabled", havingValue = "true")
public class ReportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReportRunner.class);

    private final PortfolioReportService reportService;
    private final ConsoleTableRenderer tableRenderer;
    private final CsvReportWriter csvReportWriter;
    private final CorrelationIdService correlationIdService;

    @Value("${app.runner.csv-out:kraken_trade_averages.csv}")
    private String csvOut;

    @Value("${app.runner.adjustments:}")
    private String adjustments;

    public ReportRunner(PortfolioReportService reportService,
                        ConsoleTableRenderer tableRenderer,
                        CsvReportWriter csvReportWriter,
                        CorrelationIdService correlationIdService) {
        this.reportService = reportService;
        this.tableRenderer = tableRenderer;
        this.csvReportWriter = csvReportWriter;
        this.correlationIdService = correlationIdService;
    }

    @Override
    public void run(ApplicationArguments args) {
        correlationIdService.beginBatch();
        try {
            List<AdjustmentRequest> requests = BalanceAdjustmentService.parseTargets(adjustments);
            PortfolioReport report = reportService.generateFromSources(requests);

            System.out.println(tableRenderer.render(report.getRows()));
            if (!report.getSkipped().isEmpty()) {
                log.warn("{} trade records were skipped, see earlier warnings", report.getSkipped().size());
            }
            if (csvReportWriter.write(report.getRows(), Path.of(csvOut))) {
                System.out.println("\nSaved CSV: " + csvOut);
            }
        } finally {
            correlationIdService.clear();
        }
    }
}
