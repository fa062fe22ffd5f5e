package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Снимок конфигурации эндпоинта из хранилища конфигураций.
 * Только для чтения на время одного прогона оценки.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EndpointConfig {
    String id;
    String name;
    
    /** IP-адреса или CIDR-подсети */
    @Builder.Default
    List<String> whitelist = List.of();
    
    ThrottlingRule throttling;
    QuotaRule quota;
    AuthMethod authMethod;
    AllowedHoursWindow allowedHours;
    
    /** Эндпоинт осознанно открыт 24/7 */
    boolean alwaysOpenJustified;
    
    Boolean clientSsl;
    Boolean backendSsl;
    @Builder.Default
    List<String> backendAddresses = List.of();
    
    /** Переопределение "безопасного" лимита запросов в час для этого эндпоинта */
    Double safeThrottleRatePerHour;
    
    @Builder.Default
    String timeZone = "UTC";
    
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
    
    public ZoneId zoneId() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
