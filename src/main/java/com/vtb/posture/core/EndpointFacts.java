package com.vtb.posture.core;

import com.vtb.posture.models.AuthMethod;
import com.vtb.posture.models.TrafficSample;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.List;

/**
 * Нормализованные факты об эндпоинте, которые нужны скорерам.
 * Поля трафика никогда не null: при отсутствии трафика здесь нули.
 */
@Value
@Builder
public class EndpointFacts {
    String endpointId;
    String endpointName;
    ZoneId zone;
    
    int whitelistEntries;
    int observedSourceIps;
    int uncoveredSourceIps;
    @Builder.Default
    List<String> uncoveredSamples = List.of();
    
    boolean throttlePresent;
    boolean throttleBounded;
    double throttleRatePerHour;
    double safeThrottleRatePerHour;
    
    boolean quotaPresent;
    
    /** null, если метод аутентификации не указан в конфигурации */
    AuthMethod authMethod;
    
    boolean allowedHoursPresent;
    boolean alwaysOpenJustified;
    
    Boolean clientSsl;
    Boolean backendSsl;
    long httpsEntries;
    long httpEntries;
    int backendAddresses;
    int secureBackendAddresses;
    @Builder.Default
    List<String> insecureBackends = List.of();
    
    boolean trafficAvailable;
    long totalRequests;
    long droppedOutOfRange;
    
    /** Записи, попавшие в период анализа */
    @Builder.Default
    TrafficSample traffic = TrafficSample.empty();
}
