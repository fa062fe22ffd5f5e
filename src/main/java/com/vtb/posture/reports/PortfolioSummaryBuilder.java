package com.vtb.posture.reports;

import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.PortfolioSummary;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.SecurityLevel;
import com.vtb.posture.models.Severity;
import com.vtb.posture.models.TimeRange;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сводка по всем эндпоинтам для обзорной страницы
 */
public class PortfolioSummaryBuilder {

    private static final int TOP_ISSUES = 10;

    public PortfolioSummary build(List<ScoreReport> reports, List<String> failedEndpoints,
                                  TimeRange range, Instant generatedAt) {
        Map<String, Long> byLevel = new LinkedHashMap<>();
        for (SecurityLevel level : SecurityLevel.values()) {
            byLevel.put(level.name(), 0L);
        }
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.getCode(), 0L);
        }
        Map<String, Long> byComponent = new LinkedHashMap<>();
        for (ScoreComponent component : ScoreComponent.values()) {
            byComponent.put(component.getId(), 0L);
        }

        List<PortfolioSummary.EndpointLine> lines = new ArrayList<>();
        List<PortfolioSummary.Issue> issues = new ArrayList<>();
        double scoreSum = 0.0;
        long totalRecommendations = 0;

        for (ScoreReport report : reports) {
            CompositeScoreResult result = report.getResult();
            scoreSum += result.getOverallScore();
            byLevel.merge(result.getLevel().name(), 1L, Long::sum);

            for (Recommendation rec : result.getRecommendations()) {
                totalRecommendations++;
                bySeverity.merge(rec.getSeverity().getCode(), 1L, Long::sum);
                byComponent.merge(rec.getComponent().getId(), 1L, Long::sum);
                if (rec.getSeverity() == Severity.CRITICAL || rec.getSeverity() == Severity.HIGH) {
                    issues.add(PortfolioSummary.Issue.builder()
                        .endpointId(report.getEndpointId())
                        .endpointName(report.getEndpointName())
                        .severity(rec.getSeverity())
                        .component(rec.getComponent())
                        .title(rec.getTitle())
                        .build());
                }
            }

            lines.add(PortfolioSummary.EndpointLine.builder()
                .endpointId(report.getEndpointId())
                .endpointName(report.getEndpointName())
                .score(result.getOverallScore())
                .level(result.getLevel())
                .criticalRecommendations(result.countBySeverity(Severity.CRITICAL))
                .highRecommendations(result.countBySeverity(Severity.HIGH))
                .build());
        }

        // Худшие эндпоинты первыми
        lines.sort(Comparator.comparingDouble(PortfolioSummary.EndpointLine::getScore)
            .thenComparing(PortfolioSummary.EndpointLine::getEndpointId));
        issues.sort(Comparator
            .comparingInt((PortfolioSummary.Issue i) -> i.getSeverity().getPriority()).reversed()
            .thenComparing(PortfolioSummary.Issue::getEndpointId)
            .thenComparingInt(i -> i.getComponent().ordinal()));

        double average = reports.isEmpty() ? 0.0
            : BigDecimal.valueOf(scoreSum / reports.size()).setScale(2, RoundingMode.HALF_UP).doubleValue();

        List<String> failed = failedEndpoints != null ? List.copyOf(failedEndpoints) : List.of();
        return PortfolioSummary.builder()
            .generatedAt(generatedAt)
            .timeRange(range)
            .totalEndpoints(reports.size() + failed.size())
            .scoredEndpoints(reports.size())
            .failedEndpoints(failed)
            .averageScore(average)
            .endpointsByLevel(byLevel)
            .totalRecommendations(totalRecommendations)
            .recommendationsBySeverity(bySeverity)
            .recommendationsByComponent(byComponent)
            .endpoints(List.copyOf(lines))
            .topIssues(List.copyOf(issues.subList(0, Math.min(TOP_ISSUES, issues.size()))))
            .build();
    }
}
