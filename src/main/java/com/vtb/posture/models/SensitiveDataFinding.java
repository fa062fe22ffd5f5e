package com.vtb.posture.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Результат поиска чувствительных данных в заголовках и теле записей журнала
 */
@Value
@Builder
@Jacksonized
public class SensitiveDataFinding {
    long scannedEntries;
    long matchingEntries;
    long headerMatchingEntries;
    long bodyMatchingEntries;
    
    /** 0-100, два знака после запятой */
    double matchPercentage;
    
    /** Нечего было сканировать: отличается от "чувствительных данных не найдено" */
    boolean noData;
    
    long keywordSetVersion;
    
    @Builder.Default
    List<KeywordHit> hits = List.of();
    
    public static SensitiveDataFinding noData(long keywordSetVersion) {
        return SensitiveDataFinding.builder()
            .noData(true)
            .keywordSetVersion(keywordSetVersion)
            .build();
    }
    
    public boolean sensitiveDataFound() {
        return matchingEntries > 0;
    }
}
