package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Метод аутентификации эндпоинта и его фиксированная "сила"
 */
public enum AuthMethod {
    NONE(0),
    API_KEY(40),
    BASIC(50),
    OAUTH(80),
    JWT(90),
    MTLS(100);
    
    private final int strength;
    
    AuthMethod(int strength) {
        this.strength = strength;
    }
    
    public int getStrength() {
        return strength;
    }
    
    /**
     * Разобрать значение из конфигурации.
     * Неизвестное или пустое значение трактуется как NONE.
     */
    @JsonCreator
    public static AuthMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT)
            .replace("-", "_")
            .replace(" ", "_");
        switch (normalized) {
            case "APIKEY":
            case "API_KEY":
                return API_KEY;
            case "OAUTH2":
            case "OAUTH":
                return OAUTH;
            case "MUTUAL_TLS":
            case "MTLS":
                return MTLS;
            default:
                break;
        }
        for (AuthMethod method : values()) {
            if (method.name().equals(normalized)) {
                return method;
            }
        }
        return NONE;
    }
}
