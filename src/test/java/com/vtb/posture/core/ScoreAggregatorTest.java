package com.vtb.posture.core;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SecurityLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoreAggregatorTest {

    @Test
    void defaultWeightsSumToOne() {
        double sum = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            sum += component.getDefaultWeight();
        }
        assertEquals(1.0, sum, 1e-9);
        assertDoesNotThrow(() -> ScoreAggregator.validateWeights(defaultWeights()));
    }

    @Test
    void rejectsWeightsThatDoNotSumToOne() {
        Map<ScoreComponent, Double> weights = defaultWeights();
        weights.put(ScoreComponent.LOGGING, 0.25);
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> ScoreAggregator.validateWeights(weights));
        assertTrue(error.getMessage().contains("Сумма весов"));
    }

    @Test
    void rejectsMissingOrOutOfRangeWeight() {
        Map<ScoreComponent, Double> missing = defaultWeights();
        missing.remove(ScoreComponent.QUOTA);
        assertThrows(IllegalStateException.class, () -> ScoreAggregator.validateWeights(missing));

        Map<ScoreComponent, Double> zero = defaultWeights();
        zero.put(ScoreComponent.QUOTA, 0.0);
        zero.put(ScoreComponent.ALLOWED_HOURS, 0.10);
        assertThrows(IllegalStateException.class, () -> ScoreAggregator.validateWeights(zero));

        Map<ScoreComponent, Double> nan = defaultWeights();
        nan.put(ScoreComponent.QUOTA, Double.NaN);
        assertThrows(IllegalStateException.class, () -> ScoreAggregator.validateWeights(nan));

        assertThrows(IllegalStateException.class, () -> ScoreAggregator.validateWeights(null));
    }

    @Test
    void settingsBuilderValidatesWeightsAtConstruction() {
        Map<ScoreComponent, Double> weights = defaultWeights();
        weights.put(ScoreComponent.AUTHENTICATION, 0.5);
        assertThrows(IllegalStateException.class, () -> ScoringSettings.builder().weights(weights).build());
    }

    @Test
    void compositeIsWeightedSumRoundedToHundredths() {
        List<ComponentScore> components = new ArrayList<>();
        for (ScoreComponent component : ScoreComponent.values()) {
            double score = component == ScoreComponent.AUTHENTICATION ? 33.333 : 100.0;
            components.add(ComponentScore.builder()
                .component(component)
                .score(score)
                .weight(component.getDefaultWeight())
                .build());
        }
        // 0.8 * 100 + 0.2 * 33.333 = 86.6666
        assertEquals(86.67, ScoreAggregator.composite(components));
        assertEquals(SecurityLevel.GOOD, ScoreAggregator.level(86.67));
    }

    @Test
    void compositeStaysWithinBounds() {
        List<ComponentScore> zeros = new ArrayList<>();
        List<ComponentScore> full = new ArrayList<>();
        for (ScoreComponent component : ScoreComponent.values()) {
            zeros.add(ComponentScore.builder().component(component).score(0).weight(component.getDefaultWeight()).build());
            full.add(ComponentScore.builder().component(component).score(100).weight(component.getDefaultWeight()).build());
        }
        assertEquals(0.0, ScoreAggregator.composite(zeros));
        assertEquals(100.0, ScoreAggregator.composite(full));
    }

    private static Map<ScoreComponent, Double> defaultWeights() {
        Map<ScoreComponent, Double> weights = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            weights.put(component, component.getDefaultWeight());
        }
        return weights;
    }
}
