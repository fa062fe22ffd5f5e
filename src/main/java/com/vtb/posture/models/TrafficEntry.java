package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Одна запись журнала трафика
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrafficEntry {
    Instant timestamp;
    int status;
    String sourceIp;
    
    /** http / https, если известно */
    String scheme;
    
    @Builder.Default
    Map<String, String> headers = Map.of();
    
    /** Может отсутствовать или быть обрезанным */
    String body;
    
    /**
     * Значение заголовка без учета регистра имени
     */
    public String header(String name) {
        if (name == null || headers == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
    
    /**
     * true/false для известной схемы, null если схема не записана
     */
    public Boolean secure() {
        if (scheme == null || scheme.isBlank()) {
            return null;
        }
        String normalized = scheme.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("https") || normalized.equals("wss")) {
            return Boolean.TRUE;
        }
        if (normalized.startsWith("http") || normalized.equals("ws")) {
            return Boolean.FALSE;
        }
        return null;
    }
}
