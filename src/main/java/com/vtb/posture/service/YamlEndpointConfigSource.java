package com.vtb.posture.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.posture.models.EndpointConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Конфигурации эндпоинтов из YAML или JSON файла.
 *
 * Файл перечитывается при каждом обращении, поэтому оценка всегда видит
 * актуальное состояние. Корень: список эндпоинтов или объект с ключом endpoints.
 */
@Slf4j
public class YamlEndpointConfigSource implements EndpointConfigSource {

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public YamlEndpointConfigSource(Path file) {
        this.file = file;
    }

    @Override
    public Optional<EndpointConfig> findById(String endpointId) {
        if (endpointId == null) {
            return Optional.empty();
        }
        return findAll().stream()
            .filter(config -> endpointId.equals(config.getId()))
            .findFirst();
    }

    @Override
    public List<EndpointConfig> findAll() {
        if (!Files.isReadable(file)) {
            throw new IllegalStateException("Файл конфигураций эндпоинтов недоступен: " + file.toAbsolutePath());
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка чтения конфигураций эндпоинтов " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        JsonNode list = root.isArray() ? root : root.path("endpoints");
        if (!list.isArray()) {
            return List.of();
        }

        List<EndpointConfig> configs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode node : list) {
            EndpointConfig config;
            try {
                config = mapper.treeToValue(node, EndpointConfig.class);
            } catch (IOException e) {
                log.warn("Пропущена некорректная конфигурация эндпоинта в {}: {}", file, e.getMessage());
                continue;
            }
            if (config.getId() == null || config.getId().isBlank()) {
                log.warn("Пропущена конфигурация без id в {}", file);
                continue;
            }
            if (!seen.add(config.getId())) {
                log.warn("Повторный id {} в {}, используется первое определение", config.getId(), file);
                continue;
            }
            configs.add(config);
        }
        return Collections.unmodifiableList(configs);
    }
}
