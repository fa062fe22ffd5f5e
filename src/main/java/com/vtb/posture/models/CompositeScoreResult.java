package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Итог оценки эндпоинта. Единственное значение, которое получают
 * дашборд, экспорт и share-ссылки. Пересчитывается на каждый запрос.
 */
@Value
@Builder
@Jacksonized
public class CompositeScoreResult {
    double overallScore;
    SecurityLevel level;
    @Builder.Default
    List<ComponentScore> components = List.of();
    TrafficStats trafficStats;
    SensitiveDataFinding sensitiveData;
    @Builder.Default
    List<Recommendation> recommendations = List.of();
    
    public ComponentScore component(ScoreComponent component) {
        return components.stream()
            .filter(c -> c.getComponent() == component)
            .findFirst()
            .orElse(null);
    }
    
    public long countBySeverity(Severity severity) {
        return recommendations.stream()
            .filter(r -> r.getSeverity() == severity)
            .count();
    }
    
    public boolean hasCriticalRecommendations() {
        return recommendations.stream()
            .anyMatch(r -> r.getSeverity() == Severity.CRITICAL || r.getSeverity() == Severity.HIGH);
    }
}
