package com.bank.ledger.infrastructure.export;

import com.bank.ledger.domain.model.ReportRow;

import java.util.List;

/**
 * Renders report rows as a padded, pipe separated text table
 */
public class ConsoleTableRenderer {

    static final String EMPTY_MESSAGE = "No trades found.";
    private static final String SEPARATOR = " | ";

    public String render(List<ReportRow> rows) {
        if (rows.isEmpty()) {
            return EMPTY_MESSAGE;
        }
        String[] headers = ReportRow.COLUMNS.toArray(new String[0]);
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) {
            widths[i] = headers[i].length();
        }
        for (ReportRow row : rows) {
            String[] values = row.values();
            for (int i = 0; i < values.length; i++) {
                widths[i] = Math.max(widths[i], values[i].length());
            }
        }

        StringBuilder table = new StringBuilder();
        String headerLine = line(headers, widths);
        table.append(headerLine).append('\n');
        table.append("-".repeat(headerLine.length()));
        for (ReportRow row : rows) {
            table.append('\n').append(line(row.values(), widths));
        }
        return table.toString();
    }

    private static String line(String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                line.append(SEPARATOR);
            }
            line.append(cells[i]).append(" ".repeat(widths[i] - cells[i].length()));
        }
        return line.toString();
    }
}
