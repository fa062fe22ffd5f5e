package com.vtb.posture.core;

/**
 * Некорректный период анализа. Отклоняется до любых запросов к хранилищам.
 */
public class InvalidTimeRangeException extends IllegalArgumentException {
    
    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
