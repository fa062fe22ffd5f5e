package com.vtb.posture.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vtb.posture.config.PostureConfig;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Журнал трафика из Elasticsearch.
 *
 * Записи читаются страницами через search_after от новых к старым и
 * возвращаются в хронологическом порядке. Выборка ограничена maxEntries:
 * при переполнении остаются самые новые записи, а выборка помечается
 * как урезанная. При сетевой ошибке или ответе 5xx запрос
 * повторяется не больше maxRetries раз, ответ 4xx считается окончательным.
 */
@Slf4j
public class ElasticsearchTrafficLogSource implements TrafficLogSource {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final PostureConfig.Elasticsearch settings;
    private final PostureConfig.FieldMapping fields;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public ElasticsearchTrafficLogSource(PostureConfig.Elasticsearch settings) {
        this.settings = settings;
        this.fields = settings.getFields();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(settings.getConnectTimeoutSec(), TimeUnit.SECONDS)
            .readTimeout(settings.getReadTimeoutSec(), TimeUnit.SECONDS)
            .writeTimeout(settings.getReadTimeoutSec(), TimeUnit.SECONDS)
            .callTimeout(settings.getConnectTimeoutSec() + settings.getReadTimeoutSec(), TimeUnit.SECONDS)
            .followRedirects(false)
            .retryOnConnectionFailure(false)
            .build();
        log.info("Elasticsearch: {} индекс {}", settings.getUrl(), settings.getIndex());
    }

    @Override
    public TrafficSample fetch(String endpointId, TimeRange range, ZoneId zone) {
        String from = range.startInstant(zone).toString();
        String to = range.endExclusive(zone).toString();
        List<TrafficEntry> entries = new ArrayList<>();
        JsonNode searchAfter = null;
        boolean exhausted = false;
        int pages = 0;

        while (entries.size() < settings.getMaxEntries()) {
            int size = Math.min(settings.getPageSize(), settings.getMaxEntries() - entries.size());
            JsonNode hits = execute(buildQuery(endpointId, from, to, size, searchAfter)).path("hits").path("hits");
            pages++;
            if (!hits.isArray() || hits.size() == 0) {
                exhausted = true;
                break;
            }
            for (JsonNode hit : hits) {
                TrafficEntry entry = toEntry(hit.path("_source"));
                if (entry != null) {
                    entries.add(entry);
                }
                searchAfter = hit.path("sort");
            }
            if (hits.size() < size || searchAfter == null || !searchAfter.isArray()) {
                exhausted = true;
                break;
            }
        }

        // Лимит исчерпан ровно на границе: проверяем, остались ли более старые записи
        boolean truncated = !exhausted && hasMoreAfter(endpointId, from, to, searchAfter);
        if (truncated) {
            log.warn("Эндпоинт {}: выборка ограничена {} самыми новыми записями", endpointId, settings.getMaxEntries());
        }
        Collections.reverse(entries);
        log.debug("Эндпоинт {}: получено {} записей за {} страниц", endpointId, entries.size(), pages);
        return TrafficSample.of(entries, truncated);
    }

    private boolean hasMoreAfter(String endpointId, String from, String to, JsonNode searchAfter) {
        if (searchAfter == null || !searchAfter.isArray()) {
            return false;
        }
        JsonNode hits = execute(buildQuery(endpointId, from, to, 1, searchAfter)).path("hits").path("hits");
        return hits.isArray() && hits.size() > 0;
    }

    String buildQuery(String endpointId, String from, String to, int size, JsonNode searchAfter) {
        ObjectNode query = mapper.createObjectNode();
        query.put("size", size);
        query.put("track_total_hits", false);

        ArrayNode filter = query.putObject("query").putObject("bool").putArray("filter");
        filter.addObject().putObject("term").put(fields.getEndpoint(), endpointId);
        ObjectNode timeRange = filter.addObject().putObject("range").putObject(fields.getTimestamp());
        timeRange.put("gte", from);
        timeRange.put("lt", to);

        ArrayNode sort = query.putArray("sort");
        sort.addObject().put(fields.getTimestamp(), "desc");
        sort.addObject().put("_doc", "desc");

        if (searchAfter != null && searchAfter.isArray()) {
            query.set("search_after", searchAfter);
        }
        return query.toString();
    }

    private JsonNode execute(String query) {
        String url = settings.getUrl().replaceAll("/+$", "") + "/" + settings.getIndex() + "/_search";
        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(RequestBody.create(query, JSON));
        if (settings.getUsername() != null && !settings.getUsername().isBlank()) {
            builder.header("Authorization", Credentials.basic(settings.getUsername(),
                settings.getPassword() != null ? settings.getPassword() : ""));
        }
        Request request = builder.build();

        int attempts = settings.getMaxRetries() + 1;
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                if (response.isSuccessful()) {
                    return mapper.readTree(body);
                }
                lastError = "HTTP " + response.code();
                if (response.code() < 500) {
                    throw new TrafficSourceException("Elasticsearch отклонил запрос: " + lastError + " " + abbreviate(body));
                }
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            }
            if (attempt < attempts) {
                log.warn("Elasticsearch: попытка {}/{} не удалась ({}), повтор", attempt, attempts, lastError);
                pause();
            }
        }
        throw new TrafficSourceException("Elasticsearch недоступен после " + attempts + " попыток: " + lastError);
    }

    private void pause() {
        if (settings.getRetryDelayMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(settings.getRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrafficSourceException("Чтение журнала прервано");
        }
    }

    private TrafficEntry toEntry(JsonNode source) {
        if (source == null || !source.isObject()) {
            return null;
        }
        JsonNode status = field(source, fields.getStatus());
        return TrafficEntry.builder()
            .timestamp(parseTimestamp(field(source, fields.getTimestamp())))
            .status(status.canConvertToInt() ? status.asInt() : parseInt(status.asText()))
            .sourceIp(text(field(source, fields.getClientIp())))
            .scheme(text(field(source, fields.getScheme())))
            .headers(headers(field(source, fields.getHeaders())))
            .body(body(field(source, fields.getBody())))
            .build();
    }

    /**
     * Поле по имени; имя с точками сначала ищется целиком, затем как путь
     */
    static JsonNode field(JsonNode source, String name) {
        JsonNode direct = source.path(name);
        if (!direct.isMissingNode() || !name.contains(".")) {
            return direct;
        }
        JsonNode node = source;
        for (String part : name.split("\\.")) {
            node = node.path(part);
        }
        return node;
    }

    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        String value = node.asText();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static Map<String, String> headers(JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> header = it.next();
                JsonNode value = header.getValue();
                headers.put(header.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        } else if (node.isTextual()) {
            // Заголовки одной строкой "Name: value" через перевод строки
            for (String line : node.asText().split("\\r?\\n")) {
                int colon = line.indexOf(':');
                if (colon > 0) {
                    headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                } else if (!line.isBlank()) {
                    headers.put("raw", line.trim());
                }
            }
        }
        return headers;
    }

    private static String body(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
