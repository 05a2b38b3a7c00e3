package com.bank.ledger.infrastructure.export;

import com.bank.ledger.domain.model.ReportRow;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes report rows to a CSV file that opens directly in a spreadsheet
 */
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(ReportRow.class).withHeader();

    /**
     * @return false when there was nothing to write
     */
    public boolean write(List<ReportRow> rows, Path path) {
        if (rows.isEmpty()) {
            return false;
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            CSV_MAPPER.writer(SCHEMA).writeValue(writer, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + path, e);
        }
        log.info("Wrote {}", path);
        return true;
    }
}
