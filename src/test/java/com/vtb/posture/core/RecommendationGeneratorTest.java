package com.vtb.posture.core;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.Severity;
import com.vtb.posture.models.TrafficStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.vtb.posture.core.EndpointFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationGeneratorTest {

    private final SecurityScoringEngine engine =
        new SecurityScoringEngine(ScoringSettings.defaults(), () -> keywords("password"));

    @Test
    void severityByRatioToThreshold() {
        assertEquals(Severity.CRITICAL, RecommendationGenerator.severityFor(0, 60));
        assertEquals(Severity.CRITICAL, RecommendationGenerator.severityFor(14.9, 60));
        assertEquals(Severity.HIGH, RecommendationGenerator.severityFor(15, 60));
        assertEquals(Severity.MEDIUM, RecommendationGenerator.severityFor(30, 60));
        assertEquals(Severity.LOW, RecommendationGenerator.severityFor(45, 60));
        assertEquals(Severity.LOW, RecommendationGenerator.severityFor(59.99, 60));
    }

    @Test
    void exactlyOneRecommendationPerComponentBelowThreshold() {
        CompositeScoreResult result = engine.score(bare(), businessHoursTraffic(1), week());

        List<ScoreComponent> below = result.getComponents().stream()
            .filter(ComponentScore::belowThreshold)
            .map(ComponentScore::getComponent)
            .collect(Collectors.toList());
        List<ScoreComponent> recommended = result.getRecommendations().stream()
            .map(Recommendation::getComponent)
            .collect(Collectors.toList());

        assertEquals(below.size(), recommended.size());
        assertTrue(recommended.containsAll(below));
        assertEquals(below.size(), recommended.stream().distinct().count());
    }

    @Test
    void orderedBySeverityThenDeclarationOrder() {
        CompositeScoreResult result = engine.score(bare(), businessHoursTraffic(1), week());
        List<Recommendation> recommendations = result.getRecommendations();
        for (int i = 1; i < recommendations.size(); i++) {
            Recommendation previous = recommendations.get(i - 1);
            Recommendation current = recommendations.get(i);
            int bySeverity = Integer.compare(current.getSeverity().getPriority(), previous.getSeverity().getPriority());
            assertTrue(bySeverity <= 0, "Нарушен порядок критичности");
            if (bySeverity == 0) {
                assertTrue(previous.getComponent().ordinal() < current.getComponent().ordinal(),
                    "Нарушен порядок компонентов");
            }
        }
    }

    @Test
    void hardenedEndpointHasNoRecommendations() {
        CompositeScoreResult result = engine.score(hardened(), businessHoursTraffic(1), week());
        assertTrue(result.getRecommendations().isEmpty());
    }

    @Test
    void textsCarryRunFacts() {
        CompositeScoreResult result = engine.score(bare(), businessHoursTraffic(2), week());

        Recommendation throttling = find(result, ScoreComponent.THROTTLING);
        // Пик 2 запроса в час, лимит с запасом 20%
        assertTrue(throttling.getAction().contains("~2 запросов/час"), throttling.getAction());

        Recommendation hours = find(result, ScoreComponent.ALLOWED_HOURS);
        assertTrue(hours.getAction().contains("08:00-13:00"), hours.getAction());

        Recommendation whitelist = find(result, ScoreComponent.IP_WHITELIST);
        assertTrue(whitelist.getDescription().contains("2 уникальных IP"), whitelist.getDescription());
    }

    @Test
    void suggestedThrottleAddsHeadroom() {
        TrafficStats stats = TrafficStats.builder().peakRequestsPerHour(500).build();
        assertEquals(600, RecommendationGenerator.suggestedThrottle(stats));
        assertEquals(0, RecommendationGenerator.suggestedThrottle(TrafficStats.builder().build()));
        assertNull(RecommendationGenerator.suggestedWindow(TrafficStats.builder().build()));
        assertEquals("09:00-18:00", RecommendationGenerator.suggestedWindow(
            TrafficStats.builder().peakHours(List.of(9, 12, 17)).build()));
    }

    private static Recommendation find(CompositeScoreResult result, ScoreComponent component) {
        return result.getRecommendations().stream()
            .filter(r -> r.getComponent() == component)
            .findFirst()
            .orElseThrow(() -> new AssertionError("Нет рекомендации для " + component));
    }
}
