package org.carball.pvadvisor.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;
import org.carball.pvadvisor.model.sheet.SheetExport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads worksheet descriptors from the JSON file written by the spreadsheet ingestion step.
 */
@Slf4j
public class SheetExportConnector {

    private final Path path;
    private final JsonNode exportData;

    public SheetExportConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Sheet export file not found: " + path);
        }

        this.path = path;
        this.exportData = new ObjectMapper().readTree(Files.readString(path));

        validateExportFormat();
    }

    public SheetExport load() {
        List<SheetDescriptor> sheets = new ArrayList<>();
        for (JsonNode sheetNode : exportData.get("sheets")) {
            sheets.add(parseSheet(sheetNode));
        }

        JsonNode totalSheets = exportData.get("totalSheets");
        if (totalSheets != null && totalSheets.asInt() != sheets.size()) {
            log.warn("Export declares {} sheets but contains {}", totalSheets.asInt(), sheets.size());
        }

        log.info("Loaded {} sheets from {}", sheets.size(), path.getFileName());
        return new SheetExport(path.getFileName().toString(), sheets);
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in sheet export file");
        }

        JsonNode sheets = exportData.get("sheets");
        if (sheets == null || !sheets.isArray()) {
            throw new IllegalStateException("Missing or invalid sheets section in sheet export file");
        }
    }

    private SheetDescriptor parseSheet(JsonNode sheetNode) {
        String name = sheetNode.hasNonNull("name") ? sheetNode.get("name").asText() : "";

        List<String> headers = new ArrayList<>();
        JsonNode headerNode = sheetNode.get("headers");
        if (headerNode != null && headerNode.isArray()) {
            for (JsonNode cell : headerNode) {
                headers.add(cell.isNull() ? "" : cell.asText());
            }
        }

        List<List<Object>> preview = new ArrayList<>();
        JsonNode previewNode = sheetNode.get("preview");
        if (previewNode != null && previewNode.isArray()) {
            for (JsonNode rowNode : previewNode) {
                List<Object> row = new ArrayList<>();
                if (rowNode.isArray()) {
                    for (JsonNode cell : rowNode) {
                        row.add(toValue(cell));
                    }
                }
                preview.add(row);
            }
        }

        int rowCount = sheetNode.hasNonNull("rowCount") ? sheetNode.get("rowCount").asInt() : preview.size();
        int columnCount = sheetNode.hasNonNull("columnCount") ? sheetNode.get("columnCount").asInt() : headers.size();

        log.debug("Sheet '{}': {} headers, {} preview rows, rowCount {}, columnCount {}",
                name, headers.size(), preview.size(), rowCount, columnCount);

        return new SheetDescriptor(name, headers, preview, rowCount, columnCount);
    }

    static Object toValue(JsonNode cell) {
        if (cell == null || cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        if (cell.isBoolean()) {
            return cell.booleanValue();
        }
        if (cell.isInt()) {
            return cell.intValue();
        }
        if (cell.isIntegralNumber()) {
            return cell.longValue();
        }
        if (cell.isNumber()) {
            return cell.doubleValue();
        }
        if (cell.isTextual()) {
            return cell.textValue();
        }
        // nested structures are kept as their JSON text
        return cell.toString();
    }
}
