package com.vtb.posture.service;

import com.vtb.posture.models.EndpointConfig;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище конфигураций эндпоинтов (только чтение)
 */
public interface EndpointConfigSource {

    Optional<EndpointConfig> findById(String endpointId);

    List<EndpointConfig> findAll();
}
