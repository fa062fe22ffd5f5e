package com.vtb.posture.core;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SecurityLevel;

import java.util.List;
import java.util.Map;

/**
 * Взвешенная сумма оценок компонентов
 */
public final class ScoreAggregator {

    static final double WEIGHT_TOLERANCE = 1e-6;

    private ScoreAggregator() {
    }

    /**
     * Проверка весов при старте: все девять компонентов, каждый вес в (0, 1], сумма равна 1
     *
     * @throws IllegalStateException при неверной конфигурации весов
     */
    public static void validateWeights(Map<ScoreComponent, Double> weights) {
        if (weights == null) {
            throw new IllegalStateException("Веса компонентов не заданы");
        }
        double sum = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            Double weight = weights.get(component);
            if (weight == null) {
                throw new IllegalStateException("Не задан вес компонента " + component.getId());
            }
            if (weight.isNaN() || weight <= 0.0 || weight > 1.0) {
                throw new IllegalStateException("Вес компонента " + component.getId()
                    + " должен быть в (0, 1], получено " + weight);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("Сумма весов должна быть равна 1.0, получено " + sum);
        }
    }

    /**
     * Итоговая оценка: сумма score * weight, округление до сотых, диапазон [0, 100]
     */
    public static double composite(List<ComponentScore> components) {
        double total = 0.0;
        for (ComponentScore component : components) {
            total += component.getScore() * component.getWeight();
        }
        return Scores.round2(Scores.clamp(total));
    }

    public static SecurityLevel level(double compositeScore) {
        return SecurityLevel.fromScore(compositeScore);
    }
}
