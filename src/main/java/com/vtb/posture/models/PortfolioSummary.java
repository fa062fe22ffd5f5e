package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Обзор по всем эндпоинтам для главной страницы дашборда
 */
@Value
@Builder
@Jacksonized
public class PortfolioSummary {
    Instant generatedAt;
    TimeRange timeRange;
    int totalEndpoints;
    int scoredEndpoints;
    @Builder.Default
    List<String> failedEndpoints = List.of();
    double averageScore;
    @Builder.Default
    Map<String, Long> endpointsByLevel = Map.of();
    long totalRecommendations;
    @Builder.Default
    Map<String, Long> recommendationsBySeverity = Map.of();
    @Builder.Default
    Map<String, Long> recommendationsByComponent = Map.of();
    @Builder.Default
    List<EndpointLine> endpoints = List.of();
    @Builder.Default
    List<Issue> topIssues = List.of();
    
    @Value
    @Builder
    @Jacksonized
    public static class EndpointLine {
        String endpointId;
        String endpointName;
        double score;
        SecurityLevel level;
        long criticalRecommendations;
        long highRecommendations;
    }
    
    @Value
    @Builder
    @Jacksonized
    public static class Issue {
        String endpointId;
        String endpointName;
        Severity severity;
        ScoreComponent component;
        String title;
    }
}
