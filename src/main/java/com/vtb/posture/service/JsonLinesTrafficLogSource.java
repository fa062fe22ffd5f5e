package com.vtb.posture.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Журнал трафика из каталога NDJSON файлов: {каталог}/{endpointId}.jsonl,
 * одна запись {@link TrafficEntry} на строку.
 *
 * Нет файла: у эндпоинта нет записей. Нет каталога: хранилище недоступно.
 */
@Slf4j
public class JsonLinesTrafficLogSource implements TrafficLogSource {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    static final String EXTENSION = ".jsonl";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonLinesTrafficLogSource(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public TrafficSample fetch(String endpointId, TimeRange range, ZoneId zone) {
        if (endpointId == null || !SAFE_ID.matcher(endpointId).matches() || endpointId.startsWith(".")) {
            throw new TrafficSourceException("Недопустимый идентификатор эндпоинта: " + endpointId);
        }
        if (!Files.isDirectory(directory)) {
            throw new TrafficSourceException("Каталог журналов недоступен: " + directory.toAbsolutePath());
        }
        Path file = directory.resolve(endpointId + EXTENSION);
        if (!Files.exists(file)) {
            log.debug("Журнал {} не найден, трафика нет", file);
            return TrafficSample.empty();
        }

        Instant from = range.startInstant(zone);
        Instant to = range.endExclusive(zone);
        List<TrafficEntry> entries = new ArrayList<>();
        int malformed = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                TrafficEntry entry;
                try {
                    entry = mapper.readValue(line, TrafficEntry.class);
                } catch (IOException e) {
                    malformed++;
                    continue;
                }
                Instant timestamp = entry.getTimestamp();
                if (timestamp == null || (!timestamp.isBefore(from) && timestamp.isBefore(to))) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            throw new TrafficSourceException("Ошибка чтения журнала " + file + ": " + e.getMessage(), e);
        }

        if (malformed > 0) {
            log.warn("Журнал {}: пропущено {} некорректных строк", file, malformed);
        }
        log.debug("Журнал {}: {} записей за {}..{}", endpointId, entries.size(), range.getStart(), range.getEnd());
        return TrafficSample.of(entries);
    }
}
