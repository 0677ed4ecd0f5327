package org.carball.pvadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.analysis.SheetScore;
import org.carball.pvadvisor.model.analysis.SheetSelection;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores every worksheet and picks the one most likely to hold PV operations data.
 */
@Slf4j
public class SheetSelector {

    private static final int SAMPLE_ROW_CAP = 10;
    private static final int SAMPLE_ROW_WEIGHT = 10;
    private static final int HEADER_WEIGHT = 5;
    private static final int ENERGY_BONUS = 30;
    private static final int SOLAR_BONUS = 25;
    private static final int WEATHER_BONUS = 20;
    private static final int PERFORMANCE_BONUS = 15;
    private static final int FIRST_SHEET_BONUS = 10;

    public Optional<SheetSelection> select(List<SheetDescriptor> sheets) {
        if (sheets == null || sheets.isEmpty()) {
            log.info("No sheets supplied, nothing to select");
            return Optional.empty();
        }

        List<SheetScore> scores = new ArrayList<>();
        SheetDescriptor bestSheet = null;
        int bestScore = 0;

        for (int i = 0; i < sheets.size(); i++) {
            SheetDescriptor sheet = sheets.get(i);
            if (sheet == null) {
                continue;
            }
            int score = score(sheet, i == 0);
            scores.add(new SheetScore(sheet.name(), score));

            log.debug("Sheet '{}' scored {}", sheet.name(), score);

            // Strict improvement only: ties keep the earlier sheet
            if (bestSheet == null || score > bestScore) {
                bestScore = score;
                bestSheet = sheet;
            }
        }

        if (bestSheet == null) {
            log.info("Only null sheets supplied, nothing to select");
            return Optional.empty();
        }

        double confidence = Math.min(bestScore / 100.0, 1.0);
        log.info("Selected sheet '{}' (score {}, confidence {})", bestSheet.name(), bestScore,
                String.format("%.2f", confidence));

        return Optional.of(new SheetSelection(bestSheet, bestScore, confidence, scores));
    }

    public int score(SheetDescriptor sheet, boolean firstSheet) {
        int score = 0;

        // Factor 1: amount of sample data
        score += Math.min(sheet.sampleRows().size(), SAMPLE_ROW_CAP) * SAMPLE_ROW_WEIGHT;

        // Factor 2: header quality
        score += (int) sheet.nonEmptyHeaderCount() * HEADER_WEIGHT;

        // Factor 3: PV keywords, each family counted once
        score += keywordBonus(headerText(sheet));

        // Factor 4: first sheet
        if (firstSheet) {
            score += FIRST_SHEET_BONUS;
        }

        return score;
    }

    int keywordBonus(String headerText) {
        int bonus = 0;
        if (KeywordFamily.SELECTION_ENERGY.matches(headerText)) bonus += ENERGY_BONUS;
        if (KeywordFamily.SELECTION_SOLAR.matches(headerText)) bonus += SOLAR_BONUS;
        if (KeywordFamily.SELECTION_WEATHER.matches(headerText)) bonus += WEATHER_BONUS;
        if (KeywordFamily.SELECTION_PERFORMANCE.matches(headerText)) bonus += PERFORMANCE_BONUS;
        return bonus;
    }

    private String headerText(SheetDescriptor sheet) {
        return sheet.headers().stream()
                .filter(h -> !h.trim().isEmpty())
                .collect(Collectors.joining(" "));
    }
}
