package com.vtb.posture.core;

/**
 * Для прогона оценки нет обязательных данных (конфигурации эндпоинта).
 * Прогон прерывается, частичный результат не возвращается.
 */
public class MissingDataException extends RuntimeException {
    
    private final String endpointId;
    
    public MissingDataException(String endpointId, String message) {
        super(message);
        this.endpointId = endpointId;
    }
    
    public String getEndpointId() {
        return endpointId;
    }
}
