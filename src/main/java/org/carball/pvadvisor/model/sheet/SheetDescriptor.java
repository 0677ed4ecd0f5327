package org.carball.pvadvisor.model.sheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One worksheet as produced by the spreadsheet ingestion step.
 * Row 0 of {@code sampleRows} is the header row.
 */
public record SheetDescriptor(
        String name,
        List<String> headers,
        List<List<Object>> sampleRows,
        int rowCount,
        int columnCount
) {

    public SheetDescriptor {
        name = name == null ? "" : name;

        List<String> headerCopy = new ArrayList<>();
        if (headers != null) {
            for (String header : headers) {
                headerCopy.add(header == null ? "" : header);
            }
        }
        headers = Collections.unmodifiableList(headerCopy);

        List<List<Object>> rowCopy = new ArrayList<>();
        if (sampleRows != null) {
            for (List<Object> row : sampleRows) {
                rowCopy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        sampleRows = Collections.unmodifiableList(rowCopy);
    }

    /**
     * Number of data rows, excluding the header row.
     */
    public int resolvedRecordCount() {
        if (rowCount > 0) {
            return rowCount - 1;
        }
        return Math.max(sampleRows.size() - 1, 0);
    }

    public int resolvedColumnCount() {
        return columnCount > 0 ? columnCount : headers.size();
    }

    public long nonEmptyHeaderCount() {
        return headers.stream()
                .filter(h -> !h.trim().isEmpty())
                .count();
    }
}
