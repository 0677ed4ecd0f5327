package org.carball.pvadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.analysis.ColumnType;
import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers a {@link PatternProfile} from one sheet's headers and sample values.
 *
 * <p>Detection is keyword substring matching on header text. Column types come from
 * the first non-empty sample of each column only; later values are never consulted.
 */
@Slf4j
public class PatternAnalyzer {

    private static final Pattern DECIMAL_NUMBER =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final int MIN_DATE_LENGTH = 8;

    public PatternProfile analyze(SheetDescriptor sheet) {
        return analyze(sheet.headers(), sheet.sampleRows(), sheet.resolvedRecordCount());
    }

    /**
     * @param recordCount authoritative data-row count, or {@code null} to derive it from the samples
     */
    public PatternProfile analyze(List<String> headers, List<List<Object>> sampleRows, Integer recordCount) {
        List<String> safeHeaders = headers != null ? headers : List.of();
        List<List<Object>> safeRows = sampleRows != null ? sampleRows : List.of();

        ProfileAccumulator acc = new ProfileAccumulator();
        acc.recordCount = recordCount != null ? recordCount : Math.max(safeRows.size() - 1, 0);

        for (int i = 0; i < safeHeaders.size(); i++) {
            String header = safeHeaders.get(i) != null ? safeHeaders.get(i) : "";
            List<String> samples = columnSamples(safeRows, i);
            analyzeColumn(header, samples, firstNonEmpty(safeRows, i), acc);
        }

        PatternProfile profile = acc.toProfile();
        log.debug("Pattern profile: energy={}, production={}, weather={}, time={}, location={}, performance={}, units={}, records={}",
                profile.hasEnergyData(), profile.hasProductionData(), profile.hasWeatherData(),
                profile.hasTimeData(), profile.hasLocationData(), profile.hasPerformanceData(),
                profile.energyUnits(), profile.recordCount());
        return profile;
    }

    private void analyzeColumn(String header, List<String> samples, Object firstSample, ProfileAccumulator acc) {
        if (KeywordFamily.ENERGY.matches(header)) {
            acc.hasEnergyData = true;
            detectEnergyUnits(samples, acc.energyUnits);
        }

        if (KeywordFamily.PRODUCTION.matches(header)) {
            acc.hasProductionData = true;
        }

        if (KeywordFamily.WEATHER.matches(header)) {
            acc.hasWeatherData = true;
        }

        if (KeywordFamily.TIME.matches(header)) {
            acc.hasTimeData = true;
            detectTimeFormats(samples, acc.timeFormats);
        }

        if (KeywordFamily.LOCATION.matches(header)) {
            acc.hasLocationData = true;
        }

        if (KeywordFamily.PERFORMANCE.matches(header)) {
            acc.hasPerformanceData = true;
        }

        if (firstSample != null) {
            acc.columnTypes.put(header, inferColumnType(firstSample));
        }
    }

    private void detectEnergyUnits(List<String> samples, Set<String> units) {
        for (String sample : samples) {
            String lower = sample.toLowerCase(Locale.ROOT);
            if (lower.contains("kw")) units.add("kW");
            if (lower.contains("mw")) units.add("MW");
            if (lower.contains("wh")) units.add("Wh");
            if (lower.contains("mwh")) units.add("MWh");
        }
    }

    private void detectTimeFormats(List<String> samples, Set<String> formats) {
        for (String sample : samples) {
            if (sample.contains(":")) formats.add("HH:mm");
            if (sample.contains("-")) formats.add("YYYY-MM-DD");
            if (sample.contains("/")) formats.add("YYYY/MM/DD");
        }
    }

    ColumnType inferColumnType(Object sample) {
        if (isNumeric(sample)) {
            return ColumnType.NUMERIC;
        }
        String text = asText(sample);
        if (text.contains("@")) {
            return ColumnType.EMAIL;
        }
        if (text.contains("-") && text.length() >= MIN_DATE_LENGTH) {
            return ColumnType.DATE;
        }
        return ColumnType.TEXT;
    }

    private boolean isNumeric(Object value) {
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return Float.isFinite(f);
        }
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String s) {
            return DECIMAL_NUMBER.matcher(s.trim()).matches();
        }
        return false;
    }

    private List<String> columnSamples(List<List<Object>> rows, int column) {
        List<String> samples = new ArrayList<>();
        for (int r = 1; r < rows.size(); r++) {
            Object value = cell(rows.get(r), column);
            if (!isEmpty(value)) {
                samples.add(asText(value));
            }
        }
        return samples;
    }

    private Object firstNonEmpty(List<List<Object>> rows, int column) {
        for (int r = 1; r < rows.size(); r++) {
            Object value = cell(rows.get(r), column);
            if (!isEmpty(value)) {
                return value;
            }
        }
        return null;
    }

    private Object cell(List<Object> row, int column) {
        return row != null && column < row.size() ? row.get(column) : null;
    }

    private boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.trim().isEmpty());
    }

    /**
     * Stringifies a cell value; integral decimals print without a fraction part.
     */
    static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if ((value instanceof Double d && Double.isFinite(d)) || (value instanceof Float f && Float.isFinite(f))) {
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    private static class ProfileAccumulator {
        private boolean hasEnergyData;
        private boolean hasProductionData;
        private boolean hasWeatherData;
        private boolean hasTimeData;
        private boolean hasLocationData;
        private boolean hasPerformanceData;
        private final Set<String> energyUnits = new LinkedHashSet<>();
        private final Set<String> timeFormats = new LinkedHashSet<>();
        private final Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        private int recordCount;

        private PatternProfile toProfile() {
            return new PatternProfile(
                    hasEnergyData, hasProductionData, hasWeatherData,
                    hasTimeData, hasLocationData, hasPerformanceData,
                    Collections.unmodifiableSet(new LinkedHashSet<>(energyUnits)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(timeFormats)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes)),
                    recordCount);
        }
    }
}
