package org.carball.pvadvisor.narrative;

import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.recommendation.FilterType;

import java.util.Set;
import java.util.stream.Collectors;

public class KoreanNarrativeTemplates implements NarrativeTemplates {

    @Override
    public String title(DataCategory category, String sheetName) {
        return switch (category) {
            case GENERATION -> "PV Solar 발전 데이터";
            case PERFORMANCE -> "PV Solar 성능 모니터링 데이터";
            case ENVIRONMENTAL -> "PV Solar 환경 데이터";
            case GENERIC -> "PV Solar " + sheetName + " 데이터";
        };
    }

    @Override
    public String description(int recordCount, int columnCount, Set<DataFeature> features, boolean correlationSupported) {
        StringBuilder description = new StringBuilder();
        description.append("총 ").append(recordCount).append("건의 PV Solar 데이터로 구성된 ")
                .append(columnCount).append("개 필드의 구조화된 데이터입니다.");

        if (!features.isEmpty()) {
            description.append(" ")
                    .append(features.stream().map(this::featureLabel).collect(Collectors.joining(", ")))
                    .append(" 데이터를 포함하여 종합적인 PV 시스템 분석이 가능합니다.");
        }

        if (correlationSupported) {
            description.append(" 날씨 요인별 발전량 분석, 시간대별 생산 패턴 분석이 가능합니다.");
        }

        return description.toString();
    }

    @Override
    public String insight(InsightType insight) {
        return switch (insight) {
            case TIME_SERIES_TREND -> "시계열 분석을 통한 일별/주별 발전 트렌드 파악 가능";
            case WEATHER_CORRELATION -> "날씨 요인과 발전량 상관관계 분석으로 최적 운전 조건 도출";
            case PERFORMANCE_DEGRADATION -> "성능 모니터링을 통한 효율 저하 요인 분석 가능";
            case STATISTICAL_MODELING -> "다양한 수치 데이터를 활용한 통계 분석 및 예측 모델링 가능";
        };
    }

    @Override
    public String structure(int recordCount, int columnCount) {
        return String.format("PV Solar 데이터 (%d행 × %d열)", recordCount, columnCount);
    }

    @Override
    public String filterDescription(FilterType type, String column) {
        return switch (type) {
            case DATE_RANGE -> column + " 기준으로 최신 데이터 우선 필터링 (PV 데이터 최신성 중요)";
            case NUMERIC_RANGE -> column + " 유효값 범위 필터링 (에너지 데이터 품질 관리)";
            case WEATHER_RANGE -> column + " 데이터 필터링 (날씨 데이터의 영향력 분석)";
        };
    }

    private String featureLabel(DataFeature feature) {
        return switch (feature) {
            case ENERGY -> "에너지 생산";
            case WEATHER -> "날씨/환경";
            case TIME -> "시간 기록";
            case LOCATION -> "위치 정보";
            case PERFORMANCE -> "성능 모니터링";
        };
    }
}
