package com.vtb.posture.service;

/**
 * Хранилище журналов недоступно или вернуло ошибку
 */
public class TrafficSourceException extends RuntimeException {

    public TrafficSourceException(String message) {
        super(message);
    }

    public TrafficSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
