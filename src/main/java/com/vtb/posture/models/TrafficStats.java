package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Статистика трафика эндпоинта за период
 */
@Value
@Builder
@Jacksonized
public class TrafficStats {
    /** false, если выборка трафика не была получена вовсе */
    @Builder.Default
    boolean trafficAvailable = true;
    
    long totalRequests;
    
    /** Журнал отдал не все записи периода, статистика посчитана по самым новым */
    boolean sampleTruncated;
    
    /** 24 корзины по часу суток (0-23) в часовом поясе эндпоинта */
    @Builder.Default
    List<Long> hourlyCounts = List.of();
    
    long errorCount;
    double errorRate;
    
    double meanHourlyCount;
    double stdDevHourlyCount;
    double anomalyThreshold;
    @Builder.Default
    List<Integer> anomalousHours = List.of();
    
    int uniqueSourceIps;
    @Builder.Default
    Map<String, Long> topSourceIps = Map.of();
    @Builder.Default
    Map<String, Long> statusCodes = Map.of();
    @Builder.Default
    List<Integer> peakHours = List.of();
    
    double averageRequestsPerHour;
    long peakRequestsPerHour;
    
    public int anomalyCount() {
        return anomalousHours != null ? anomalousHours.size() : 0;
    }
}
