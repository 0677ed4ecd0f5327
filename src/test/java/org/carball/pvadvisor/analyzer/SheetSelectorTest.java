package org.carball.pvadvisor.analyzer;

import org.carball.pvadvisor.model.analysis.SheetScore;
import org.carball.pvadvisor.model.analysis.SheetSelection;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SheetSelectorTest {

    private SheetSelector selector;

    @BeforeEach
    void setUp() {
        selector = new SheetSelector();
    }

    @Test
    void shouldPreferSheetWithMoreDataAndEnergyHeaders() {
        // Given
        SheetDescriptor sheet1 = sheet("Sheet1", List.of("A", "B"), 3);
        SheetDescriptor sheet2 = sheet("Sheet2", List.of("Energy_Production", "Timestamp"), 8);

        // When
        Optional<SheetSelection> selection = selector.select(List.of(sheet1, sheet2));

        // Then
        assertThat(selection).isPresent();
        assertThat(selection.get().sheet().name()).isEqualTo("Sheet2");
        assertThat(selection.get().score()).isEqualTo(120);
        assertThat(selection.get().confidence()).isEqualTo(1.0);
        assertThat(selection.get().scores())
                .containsExactly(new SheetScore("Sheet1", 50), new SheetScore("Sheet2", 120));
    }

    @Test
    void shouldKeepEarlierSheetOnTie() {
        // Given - 10 + 5 + 10 (first) == 20 + 5
        SheetDescriptor first = sheet("First", List.of("x"), 1);
        SheetDescriptor second = sheet("Second", List.of("x"), 2);

        // When
        SheetSelection selection = selector.select(List.of(first, second)).orElseThrow();

        // Then
        assertThat(selection.scores()).extracting(SheetScore::score).containsExactly(25, 25);
        assertThat(selection.sheet().name()).isEqualTo("First");
    }

    @Test
    void shouldReturnEmptyForNoSheets() {
        assertThat(selector.select(List.of())).isEmpty();
        assertThat(selector.select(null)).isEmpty();
    }

    @Test
    void shouldScaleConfidenceBelowOneHundred() {
        // Given - 30 + 10 + 10
        SheetDescriptor sheet = sheet("Data", List.of("A", "B"), 3);

        // When
        SheetSelection selection = selector.select(List.of(sheet)).orElseThrow();

        // Then
        assertThat(selection.score()).isEqualTo(50);
        assertThat(selection.confidence()).isEqualTo(0.5);
    }

    @Test
    void shouldCapSampleRowContribution() {
        SheetDescriptor sheet = sheet("Big", List.of(), 40);

        assertThat(selector.score(sheet, false)).isEqualTo(100);
    }

    @Test
    void shouldCountEachKeywordFamilyOnce() {
        // Given - three energy keywords still earn one energy bonus
        SheetDescriptor sheet = sheet("Plant", List.of("Energy", "Power", "Production"), 1);

        // When
        int score = selector.score(sheet, false);

        // Then - 10 rows + 15 headers + 30 energy
        assertThat(score).isEqualTo(55);
    }

    @Test
    void shouldAddEveryMatchingFamilyBonus() {
        assertThat(selector.keywordBonus("energy pv_panel temperature efficiency")).isEqualTo(30 + 25 + 20 + 15);
        assertThat(selector.keywordBonus("solar output")).isEqualTo(25 + 15);
        assertThat(selector.keywordBonus("name address")).isZero();
    }

    @Test
    void shouldIgnoreBlankHeaders() {
        SheetDescriptor sheet = sheet("Sparse", List.of("", "  ", "Value"), 0);

        assertThat(selector.score(sheet, false)).isEqualTo(5);
    }

    @Test
    void shouldMatchKeywordsCaseInsensitively() {
        SheetDescriptor upper = sheet("Upper", List.of("SOLAR_IRRADIANCE"), 0);

        // solar 25 + weather 20 + one header 5
        assertThat(selector.score(upper, false)).isEqualTo(50);
    }

    private SheetDescriptor sheet(String name, List<String> headers, int sampleRowCount) {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < sampleRowCount; i++) {
            rows.add(List.of("r" + i));
        }
        return new SheetDescriptor(name, headers, rows, 0, headers.size());
    }
}
