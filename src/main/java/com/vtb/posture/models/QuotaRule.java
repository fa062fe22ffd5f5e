package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Квота на количество запросов за период
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuotaRule {
    @Builder.Default
    boolean enabled = true;
    long limit;
    @Builder.Default
    String period = "DAY";
    
    public boolean active() {
        return enabled && limit > 0;
    }
}
