package com.vtb.posture.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SecurityLevel;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import com.vtb.posture.reports.JsonReportGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.vtb.posture.core.EndpointFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SecurityScoringEngineTest {

    private final SecurityScoringEngine engine =
        new SecurityScoringEngine(ScoringSettings.defaults(), () -> keywords("password", "cvv", "secret"));

    @Test
    void hardenedEndpointScoresExcellent() {
        CompositeScoreResult result = engine.score(hardened(), businessHoursTraffic(3), week());

        assertEquals(100.0, result.getOverallScore());
        assertEquals(SecurityLevel.EXCELLENT, result.getLevel());
        assertEquals(ScoreComponent.values().length, result.getComponents().size());
        for (int i = 0; i < ScoreComponent.values().length; i++) {
            assertEquals(ScoreComponent.values()[i], result.getComponents().get(i).getComponent());
        }
    }

    @Test
    void bareEndpointWithEmptySample() {
        CompositeScoreResult result = engine.score(bare(), TrafficSample.empty(), week());

        // Нейтральны только трафиковые компоненты и журналирование: 0.05 + 0.05 + 0.20
        assertEquals(30.0, result.getOverallScore());
        assertEquals(SecurityLevel.CRITICAL, result.getLevel());
        assertEquals(List.of(ScoreComponent.IP_WHITELIST, ScoreComponent.THROTTLING, ScoreComponent.QUOTA,
                ScoreComponent.AUTHENTICATION, ScoreComponent.ALLOWED_HOURS, ScoreComponent.SSL_TLS),
            result.getRecommendations().stream().map(Recommendation::getComponent).toList());
    }

    @Test
    void missingSampleDegradesTrafficComponents() {
        CompositeScoreResult result = engine.score(bare(), null, week());

        assertEquals(20.0, result.getOverallScore());
        assertTrue(result.component(ScoreComponent.TRAFFIC_ANOMALY).isDegraded());
        assertTrue(result.component(ScoreComponent.ERROR_RATE).isDegraded());
        assertFalse(result.getTrafficStats().isTrafficAvailable());
        assertTrue(result.getSensitiveData().isNoData());
        assertEquals(8, result.getRecommendations().size());
    }

    @Test
    void emptySampleIsNeutralForHardenedEndpoint() {
        CompositeScoreResult result = engine.score(hardened(), TrafficSample.empty(), week());
        assertEquals(100.0, result.getOverallScore());
        for (ComponentScore component : result.getComponents()) {
            assertFalse(component.isDegraded(), component.getName());
        }
    }

    @Test
    void scoreStaysInRangeAndSumsContributions() {
        List<TrafficEntry> entries = new ArrayList<>(businessHoursTraffic(2).getEntries());
        for (int i = 0; i < 40; i++) {
            entries.add(entryWithBody(at(2, 3), "password=" + i));
        }
        CompositeScoreResult result = engine.score(bare(), TrafficSample.of(entries), week());

        assertTrue(result.getOverallScore() >= 0 && result.getOverallScore() <= 100);
        double weighted = result.getComponents().stream().mapToDouble(c -> c.getScore() * c.getWeight()).sum();
        assertEquals(Math.round(weighted * 100) / 100.0, result.getOverallScore(), 1e-9);
        assertTrue(result.component(ScoreComponent.LOGGING).getScore() < 100);
        assertFalse(result.getTrafficStats().getAnomalousHours().isEmpty());
    }

    @Test
    void identicalInputsGiveByteIdenticalJson() throws Exception {
        ObjectMapper mapper = JsonReportGenerator.createMapper();
        TrafficSample sample = businessHoursTraffic(2);

        String first = mapper.writeValueAsString(engine.score(bare(), sample, week()));
        String second = mapper.writeValueAsString(engine.score(bare(), sample, week()));
        assertEquals(first, second);
    }

    @Test
    void usesOneKeywordSnapshotPerRun() {
        AtomicReference<SensitiveKeywordSet> current = new AtomicReference<>(keywords("password"));
        SecurityScoringEngine reloadable = new SecurityScoringEngine(ScoringSettings.defaults(), current::get);
        TrafficSample sample = TrafficSample.of(List.of(entryWithBody(at(0, 9), "cvv=123")));

        assertEquals(0, reloadable.score(hardened(), sample, week()).getSensitiveData().getMatchingEntries());

        current.set(SensitiveKeywordSet.of(2L, "test", List.of("password", "cvv")));
        CompositeScoreResult after = reloadable.score(hardened(), sample, week());
        assertEquals(1, after.getSensitiveData().getMatchingEntries());
        assertEquals(2L, after.getSensitiveData().getKeywordSetVersion());
    }

    @Test
    void missingConfigAbortsRun() {
        assertThrows(MissingDataException.class, () -> engine.score(null, TrafficSample.empty(), week()));
    }
}
