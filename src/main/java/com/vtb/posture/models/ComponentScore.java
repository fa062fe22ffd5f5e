package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Оценка одного компонента с фактами, из которых она получена
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ComponentScore {
    ScoreComponent component;
    String name;
    double score;
    double weight;
    double contribution;
    double threshold;
    SecurityLevel level;
    
    /** Оценка получена по неполным данным (fail closed) */
    boolean degraded;
    
    @Builder.Default
    Map<String, String> facts = Map.of();
    
    public boolean belowThreshold() {
        return score < threshold;
    }
}
