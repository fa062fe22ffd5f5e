package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Правило ограничения частоты запросов (throttling / rate limit)
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThrottlingRule {
    @Builder.Default
    boolean enabled = true;
    long limit;
    @Builder.Default
    long windowSeconds = 3600;
    
    public boolean active() {
        return enabled;
    }
    
    /**
     * Правило без лимита или без окна ничего не ограничивает
     */
    public boolean bounded() {
        return limit > 0 && windowSeconds > 0;
    }
    
    public double ratePerHour() {
        if (!bounded()) {
            return Double.POSITIVE_INFINITY;
        }
        return limit * 3600.0 / windowSeconds;
    }
}
