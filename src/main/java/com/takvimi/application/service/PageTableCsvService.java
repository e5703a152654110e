package com.takvimi.application.service;

import com.takvimi.application.exception.UseCaseValidationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns an exported page table into downloadable CSV content.
 */
@Service
public class PageTableCsvService {

	/**
	 * Renders the rows as CSV, one line per row, cells in their detected order.
	 *
	 * @param rows table rows, header first
	 * @return CSV document as a string
	 * @throws UseCaseValidationException when there is nothing to export
	 */
    public String toCsv(List<List<String>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new UseCaseValidationException("No table rows available for export.");
        }
        StringBuilder builder = new StringBuilder();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(escape(row.get(i)));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw cell value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
