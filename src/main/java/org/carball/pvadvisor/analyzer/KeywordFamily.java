package org.carball.pvadvisor.analyzer;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Fixed keyword lists used for header classification. Matching is lowercase
 * substring containment against either the English or the Korean terms.
 *
 * <p>Flag, field-pool and filter-group lists differ slightly for the same concept;
 * each list is kept separate so that none of them drifts when another is edited.
 */
public enum KeywordFamily {

    // Sheet selection bonuses
    SELECTION_ENERGY(List.of("energy", "power", "production"), List.of()),
    SELECTION_SOLAR(List.of("solar", "pv", "panel"), List.of()),
    SELECTION_WEATHER(List.of("weather", "temperature", "irradiance"), List.of()),
    SELECTION_PERFORMANCE(List.of("performance", "efficiency", "output"), List.of()),

    // Pattern flags
    ENERGY(List.of("energy", "power", "production", "output"),
            List.of("발전량", "전력", "에너지", "생산량")),
    PRODUCTION(List.of("production", "generation"),
            List.of("발전", "생산")),
    WEATHER(List.of("weather", "temperature", "irradiance", "solar"),
            List.of("일사량", "기온")),
    TIME(List.of("time", "date", "hour", "timestamp"),
            List.of("시간", "날짜")),
    LOCATION(List.of("location", "address", "city", "region"),
            List.of("위치", "주소", "지역")),
    PERFORMANCE(List.of("performance", "efficiency"),
            List.of("효율", "성능")),

    // Rule-based field pools
    TIME_FIELD(List.of("time", "date", "timestamp"),
            List.of("시간", "날짜")),
    WEATHER_FIELD(List.of("weather", "temperature", "irradiance"),
            List.of("일사량", "기온")),

    // Filter groups
    TIME_FILTER(List.of("date", "time"),
            List.of("날짜", "시간")),
    WEATHER_FILTER(List.of("weather", "temperature", "irradiance", "solar"),
            List.of("날씨", "기온", "일사량", "태양"));

    private final List<String> englishTerms;
    private final List<String> koreanTerms;

    KeywordFamily(List<String> englishTerms, List<String> koreanTerms) {
        this.englishTerms = englishTerms;
        this.koreanTerms = koreanTerms;
    }

    public List<String> getEnglishTerms() {
        return englishTerms;
    }

    public List<String> getKoreanTerms() {
        return koreanTerms;
    }

    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return Stream.concat(englishTerms.stream(), koreanTerms.stream())
                .anyMatch(lower::contains);
    }
}
