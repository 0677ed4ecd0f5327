package org.carball.pvadvisor.analyzer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pins the keyword lists so that edits to one family are caught.
 */
class KeywordFamilyTest {

    @Test
    void shouldPinSelectionKeywords() {
        assertThat(KeywordFamily.SELECTION_ENERGY.getEnglishTerms()).containsExactly("energy", "power", "production");
        assertThat(KeywordFamily.SELECTION_SOLAR.getEnglishTerms()).containsExactly("solar", "pv", "panel");
        assertThat(KeywordFamily.SELECTION_WEATHER.getEnglishTerms()).containsExactly("weather", "temperature", "irradiance");
        assertThat(KeywordFamily.SELECTION_PERFORMANCE.getEnglishTerms()).containsExactly("performance", "efficiency", "output");
    }

    @Test
    void shouldPinFlagKeywords() {
        assertThat(KeywordFamily.ENERGY.getEnglishTerms()).containsExactly("energy", "power", "production", "output");
        assertThat(KeywordFamily.ENERGY.getKoreanTerms()).containsExactly("발전량", "전력", "에너지", "생산량");
        assertThat(KeywordFamily.PRODUCTION.getEnglishTerms()).containsExactly("production", "generation");
        assertThat(KeywordFamily.PRODUCTION.getKoreanTerms()).containsExactly("발전", "생산");
        assertThat(KeywordFamily.WEATHER.getEnglishTerms()).containsExactly("weather", "temperature", "irradiance", "solar");
        assertThat(KeywordFamily.WEATHER.getKoreanTerms()).containsExactly("일사량", "기온");
        assertThat(KeywordFamily.TIME.getEnglishTerms()).containsExactly("time", "date", "hour", "timestamp");
        assertThat(KeywordFamily.TIME.getKoreanTerms()).containsExactly("시간", "날짜");
        assertThat(KeywordFamily.LOCATION.getEnglishTerms()).containsExactly("location", "address", "city", "region");
        assertThat(KeywordFamily.LOCATION.getKoreanTerms()).containsExactly("위치", "주소", "지역");
        assertThat(KeywordFamily.PERFORMANCE.getEnglishTerms()).containsExactly("performance", "efficiency");
        assertThat(KeywordFamily.PERFORMANCE.getKoreanTerms()).containsExactly("효율", "성능");
    }

    @Test
    void shouldPinFieldPoolAndFilterKeywords() {
        assertThat(KeywordFamily.TIME_FIELD.getEnglishTerms()).containsExactly("time", "date", "timestamp");
        assertThat(KeywordFamily.WEATHER_FIELD.getEnglishTerms()).containsExactly("weather", "temperature", "irradiance");
        assertThat(KeywordFamily.TIME_FILTER.getEnglishTerms()).containsExactly("date", "time");
        assertThat(KeywordFamily.TIME_FILTER.getKoreanTerms()).containsExactly("날짜", "시간");
        assertThat(KeywordFamily.WEATHER_FILTER.getEnglishTerms()).containsExactly("weather", "temperature", "irradiance", "solar");
        assertThat(KeywordFamily.WEATHER_FILTER.getKoreanTerms()).containsExactly("날씨", "기온", "일사량", "태양");
    }

    @Test
    void shouldMatchBySubstringIgnoringCase() {
        assertThat(KeywordFamily.TIME.matches("UpdateTime")).isTrue();
        assertThat(KeywordFamily.ENERGY.matches("DC_POWER")).isTrue();
        assertThat(KeywordFamily.ENERGY.matches("누적발전량")).isTrue();
        assertThat(KeywordFamily.LOCATION.matches("Site")).isFalse();
        assertThat(KeywordFamily.TIME.matches(null)).isFalse();
        assertThat(KeywordFamily.TIME.matches("")).isFalse();
    }
}
