package com.bank.ledger.infrastructure.config;

import com.bank.ledger.infrastructure.export.ConsoleTableRenderer;
import com.bank.ledger.infrastructure.export.CsvReportWriter;
import com.bank.ledger.infrastructure.file.JsonFilePriceSource;
import com.bank.ledger.infrastructure.file.JsonFileTradeSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * File based sources and report exporters
 */
@Configuration
public class AdapterConfig {

    @Value("${app.source.file.trades:trades.json}")
    private String tradesFile;

    @Value("${app.source.file.prices:prices.json}")
    private String pricesFile;

    @Bean("fileTradeSource")
    public JsonFileTradeSource fileTradeSource(ObjectMapper objectMapper) {
        return new JsonFileTradeSource(objectMapper, Path.of(tradesFile));
    }

    @Bean("filePriceSource")
    public JsonFilePriceSource filePriceSource(ObjectMapper objectMapper) {
        return new JsonFilePriceSource(objectMapper, Path.of(pricesFile));
    }

    @Bean
    public CsvReportWriter csvReportWriter() {
        return new CsvReportWriter();
    }

    @Bean
    public ConsoleTableRenderer consoleTableRenderer() {
        return new ConsoleTableRenderer();
    }
}
