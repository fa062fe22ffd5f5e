package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Рекомендация по устранению проблемы
 */
@Value
@Builder
@Jacksonized
public class Recommendation {
    Severity severity;
    ScoreComponent component;
    String title;
    String description;
    String action;
}
