package org.carball.pvadvisor.ai;

import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the natural-language prompt that asks for a structured PV data recommendation.
 */
public class AnalysisPromptBuilder {

    static final int MAX_SAMPLE_ROWS = 5;

    public String build(SheetDescriptor sheet, PatternProfile profile) {
        List<String> headers = sheet.headers();
        StringBuilder prompt = new StringBuilder();

        prompt.append("As a PV solar data analysis expert, analyze the following data and respond in JSON.\n\n");

        prompt.append("## PV Solar Data Overview:\n");
        prompt.append("- Sheet Name: ").append(sheet.name()).append("\n");
        prompt.append("- Total Data Rows: ").append(profile.recordCount()).append(" (excluding header)\n");
        prompt.append("- Total Columns: ").append(sheet.resolvedColumnCount()).append("\n");
        prompt.append("- All Columns: ").append(String.join(", ", headers)).append("\n\n");

        prompt.append("## Detected Characteristics:\n");
        appendFlag(prompt, "Energy data", profile.hasEnergyData());
        appendFlag(prompt, "Production data", profile.hasProductionData());
        appendFlag(prompt, "Weather data", profile.hasWeatherData());
        appendFlag(prompt, "Time data", profile.hasTimeData());
        appendFlag(prompt, "Location data", profile.hasLocationData());
        appendFlag(prompt, "Performance data", profile.hasPerformanceData());
        prompt.append("- Detected energy units: ").append(
                profile.energyUnits().isEmpty() ? "none" : String.join(", ", profile.energyUnits())
        ).append("\n\n");

        prompt.append("## Sample Data:\n");
        prompt.append(serializeSampleRows(headers, sheet.sampleRows()));
        prompt.append("\n");

        prompt.append("## Analysis Guidelines:\n");
        prompt.append("1. Field selection: pick only the 5-8 fields essential for PV analysis and performance optimisation\n");
        prompt.append("   - Core: generation, power output, timestamps, weather, location\n");
        prompt.append("   - Performance: efficiency, rated output, measured values\n");
        prompt.append("   - Environment: irradiance, temperature, humidity, wind speed\n");
        prompt.append("2. Exclude: duplicated fields (prefer timestamp over time), metadata such as created_at, updated_at, id, ");
        prompt.append("mostly empty fields and administrative fields\n");
        prompt.append("3. Also analyse: peak production windows, weather impact on production, maintenance patterns, ");
        prompt.append("performance metrics (measured/rated ratio)\n\n");

        prompt.append("## Response Requirements:\n");
        prompt.append("Provide a JSON response with this exact structure:\n");
        prompt.append(getJsonSchemaExample());
        prompt.append("\nUse field names exactly as they appear in the column list.");

        return prompt.toString();
    }

    String serializeSampleRows(List<String> headers, List<List<Object>> sampleRows) {
        StringBuilder rows = new StringBuilder();
        int end = Math.min(MAX_SAMPLE_ROWS + 1, sampleRows.size());

        for (int r = 1; r < end; r++) {
            List<Object> row = sampleRows.get(r);
            String cells = IntStream.range(0, row.size())
                    .mapToObj(c -> headerAt(headers, c) + ": " + (row.get(c) == null ? "" : row.get(c)))
                    .collect(Collectors.joining(" | "));
            rows.append("Row ").append(r).append(": ").append(cells).append("\n");
        }

        return rows.toString();
    }

    private static String headerAt(List<String> headers, int index) {
        return index < headers.size() ? headers.get(index) : "";
    }

    private static void appendFlag(StringBuilder prompt, String label, boolean value) {
        prompt.append("- ").append(label).append(": ").append(value ? "yes" : "no").append("\n");
    }

    private String getJsonSchemaExample() {
        return """
        {
          "title": "PV Solar [project/plant] data",
          "description": "Characteristics, scale and analysis potential of the PV data",
          "insights": ["Key insight 1", "Business insight 2", "Data quality insight 3"],
          "recommendedFields": ["field1", "field2", "field3", "field4", "field5"],
          "pvSolarInsights": {
            "peakProductionTimes": ["expected production peak window"],
            "weatherFactors": ["weather factor"],
            "maintenancePatterns": ["maintenance pattern"],
            "performanceMetrics": ["performance metric"]
          }
        }
        """;
    }
}
