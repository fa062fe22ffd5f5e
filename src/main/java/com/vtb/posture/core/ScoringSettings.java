package com.vtb.posture.core;

import com.vtb.posture.models.ScoreComponent;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Проверенные параметры оценки. Создается один раз при старте;
 * ошибка в весах здесь фатальна и не доходит до запросов.
 */
@Getter
public final class ScoringSettings {
    
    public static final double DEFAULT_ANOMALY_SENSITIVITY = 2.0;
    public static final double DEFAULT_ANOMALY_PENALTY = 25.0;
    public static final double DEFAULT_ERROR_RATE_CEILING = 20.0;
    public static final int DEFAULT_ERROR_STATUS_FROM = 400;
    public static final double DEFAULT_SAFE_THROTTLE_RATE = 10_000.0;
    public static final int DEFAULT_SENSITIVE_SAMPLE_SIZE = 1000;
    
    private final Map<ScoreComponent, Double> weights;
    private final Map<ScoreComponent, Double> thresholds;
    
    /** k: корзина аномальна, если count > mean + k * stddev */
    private final double anomalySensitivity;
    private final double anomalyPenaltyPerBucket;
    
    /** Доля ошибок (%), при которой оценка Error Rate падает до 0 */
    private final double errorRateCeiling;
    private final int errorStatusFrom;
    private final double safeThrottleRatePerHour;
    
    /** Сколько последних записей сканировать на чувствительные данные (0 = все) */
    private final int sensitiveSampleSize;
    
    @Builder
    private ScoringSettings(Map<ScoreComponent, Double> weights,
                            Map<ScoreComponent, Double> thresholds,
                            Double anomalySensitivity,
                            Double anomalyPenaltyPerBucket,
                            Double errorRateCeiling,
                            Integer errorStatusFrom,
                            Double safeThrottleRatePerHour,
                            Integer sensitiveSampleSize) {
        EnumMap<ScoreComponent, Double> effectiveWeights = new EnumMap<>(ScoreComponent.class);
        EnumMap<ScoreComponent, Double> effectiveThresholds = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            effectiveWeights.put(component, component.getDefaultWeight());
            effectiveThresholds.put(component, component.getDefaultThreshold());
        }
        if (weights != null && !weights.isEmpty()) {
            effectiveWeights.putAll(weights);
        }
        if (thresholds != null) {
            thresholds.forEach((component, value) -> {
                if (component != null && value != null) {
                    effectiveThresholds.put(component, value);
                }
            });
        }
        ScoreAggregator.validateWeights(effectiveWeights);
        
        this.weights = Collections.unmodifiableMap(effectiveWeights);
        this.thresholds = Collections.unmodifiableMap(effectiveThresholds);
        this.anomalySensitivity = positiveOr(anomalySensitivity, DEFAULT_ANOMALY_SENSITIVITY);
        this.anomalyPenaltyPerBucket = positiveOr(anomalyPenaltyPerBucket, DEFAULT_ANOMALY_PENALTY);
        this.errorRateCeiling = positiveOr(errorRateCeiling, DEFAULT_ERROR_RATE_CEILING);
        this.errorStatusFrom = errorStatusFrom != null && errorStatusFrom > 0 ? errorStatusFrom : DEFAULT_ERROR_STATUS_FROM;
        this.safeThrottleRatePerHour = positiveOr(safeThrottleRatePerHour, DEFAULT_SAFE_THROTTLE_RATE);
        this.sensitiveSampleSize = sensitiveSampleSize != null && sensitiveSampleSize >= 0
            ? sensitiveSampleSize : DEFAULT_SENSITIVE_SAMPLE_SIZE;
    }
    
    public static ScoringSettings defaults() {
        return builder().build();
    }
    
    public double weight(ScoreComponent component) {
        return weights.get(component);
    }
    
    public double threshold(ScoreComponent component) {
        return thresholds.get(component);
    }
    
    private static double positiveOr(Double value, double fallback) {
        return value != null && value > 0 && !value.isInfinite() ? value : fallback;
    }
}
