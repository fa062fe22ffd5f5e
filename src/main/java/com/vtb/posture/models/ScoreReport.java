package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Конверт для потребителей: кто, за какой период, когда посчитан, и сам результат.
 * Время генерации живет здесь, а не в {@link CompositeScoreResult}.
 */
@Value
@Builder
@Jacksonized
public class ScoreReport {
    String endpointId;
    String endpointName;
    TimeRange timeRange;
    Instant generatedAt;
    long keywordSetVersion;
    CompositeScoreResult result;
}
