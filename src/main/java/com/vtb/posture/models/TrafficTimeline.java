package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Число запросов и ошибок по интервалам фиксированной длины.
 * Интервалы идут подряд от начала периода, пустые интервалы присутствуют с нулями.
 */
@Value
@Builder
@Jacksonized
public class TrafficTimeline {
    String endpointId;
    TimeRange timeRange;
    String timeZone;

    /** Интервал как в запросе: 15m, 1h, 1d */
    String interval;

    boolean trafficAvailable;
    boolean sampleTruncated;
    long totalRequests;
    long totalErrors;

    @Builder.Default
    List<Point> points = List.of();

    @Value
    @Builder
    @Jacksonized
    public static class Point {
        /** Начало интервала, включительно */
        Instant start;
        long requests;
        long errors;
    }
}
