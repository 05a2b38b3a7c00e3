package com.bank.ledger.infrastructure.export;

import com.bank.ledger.domain.model.ReportRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportWriterTest {

    private final CsvReportWriter writer = new CsvReportWriter();

    @TempDir
    Path tempDir;

    @Test
    void testWritesHeaderAndRowsInColumnOrder() throws Exception {
        Path out = tempDir.resolve("report.csv");

        boolean written = writer.write(List.of(row("BTC", "USD", "1.5"), row("ETH", "USD", "0")), out);

        assertTrue(written);
        List<String> lines = Files.readAllLines(out);
        assertEquals(3, lines.size());
        assertEquals(String.join(",", ReportRow.COLUMNS), lines.get(0));
        assertTrue(lines.get(1).startsWith("BTC,USD,1.5,"));
        assertTrue(lines.get(2).startsWith("ETH,USD,0,"));
        assertTrue(lines.get(1).endsWith(",no price,"));
    }

    @Test
    void testNothingWrittenForEmptyReport() {
        Path out = tempDir.resolve("empty.csv");

        assertFalse(writer.write(List.of(), out));
        assertFalse(Files.exists(out));
    }

    static ReportRow row(String asset, String quote, String bought) {
        return ReportRow.builder()
                .asset(asset).quote(quote)
                .totalBought(bought).avgBuyPrice("100")
                .totalSold("0").avgSellPrice("0")
                .netFromHistory(bought).remainingUnsoldVolume(bought)
                .avgBuyPriceOfRemaining("100").feesTotal("0").realizedPnl("0")
                .currentPrice("no price").unrealizedPnl("")
                .build();
    }
}
