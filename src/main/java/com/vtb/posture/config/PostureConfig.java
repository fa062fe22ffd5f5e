package com.vtb.posture.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.posture.core.ScoringSettings;
import com.vtb.posture.models.ScoreComponent;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Конфигурация оценщика из YAML файла.
 *
 * По умолчанию читается posture-config.yaml из classpath. Внешний файл
 * задается системным свойством posture.config или опцией --config.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostureConfig {

    public static final String DEFAULT_RESOURCE = "posture-config.yaml";
    public static final String CONFIG_PROPERTY = "posture.config";

    private Scoring scoring;
    private Keywords keywords;
    private Sources sources;
    private Dashboard dashboard;
    private Share share;

    private static PostureConfig instance;

    /**
     * Загрузить конфигурацию (один раз на процесс)
     */
    public static synchronized PostureConfig load() {
        if (instance == null) {
            String external = System.getProperty(CONFIG_PROPERTY);
            instance = external != null && !external.isBlank()
                ? loadFrom(Path.of(external))
                : loadFromClasspath(DEFAULT_RESOURCE);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из внешнего файла, без кэширования
     */
    public static PostureConfig loadFrom(Path path) {
        log.info("Загрузка конфигурации из {}", path.toAbsolutePath());
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        } catch (IOException e) {
            throw new RuntimeException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    public static PostureConfig loadFromClasspath(String resource) {
        try (InputStream is = PostureConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            return parse(is);
        } catch (IOException e) {
            throw new RuntimeException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    static PostureConfig parse(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        PostureConfig config = mapper.readValue(is, PostureConfig.class);
        if (config == null) {
            config = new PostureConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (scoring == null) {
            scoring = new Scoring();
        }
        if (keywords == null) {
            keywords = new Keywords();
        }
        keywords.ensureDefaults();
        if (sources == null) {
            sources = new Sources();
        }
        sources.ensureDefaults();
        if (dashboard == null) {
            dashboard = new Dashboard();
        }
        dashboard.ensureDefaults();
        if (share == null) {
            share = new Share();
        }
        share.ensureDefaults();
    }

    /**
     * Проверенные параметры для движка
     *
     * @throws IllegalStateException при неизвестном компоненте или неверных весах
     */
    public ScoringSettings toScoringSettings() {
        return ScoringSettings.builder()
            .weights(byComponent(scoring.getWeights(), "weights"))
            .thresholds(byComponent(scoring.getThresholds(), "thresholds"))
            .anomalySensitivity(scoring.getAnomalySensitivity())
            .anomalyPenaltyPerBucket(scoring.getAnomalyPenaltyPerBucket())
            .errorRateCeiling(scoring.getErrorRateCeiling())
            .errorStatusFrom(scoring.getErrorStatusFrom())
            .safeThrottleRatePerHour(scoring.getSafeThrottleRatePerHour())
            .sensitiveSampleSize(dashboard.getSensitiveSampleSize())
            .build();
    }

    private static Map<ScoreComponent, Double> byComponent(Map<String, Double> raw, String section) {
        Map<ScoreComponent, Double> result = new EnumMap<>(ScoreComponent.class);
        if (raw == null) {
            return result;
        }
        raw.forEach((key, value) -> {
            ScoreComponent component = ScoreComponent.fromId(key);
            if (component == null) {
                throw new IllegalStateException("Неизвестный компонент в scoring." + section + ": " + key);
            }
            if (value != null) {
                result.put(component, value);
            }
        });
        return result;
    }

    @Data
    public static class Scoring {
        private Double anomalySensitivity;
        private Double anomalyPenaltyPerBucket;
        private Double errorRateCeiling;
        private Integer errorStatusFrom;
        private Double safeThrottleRatePerHour;

        /** Ключ: идентификатор компонента (ip_whitelist_coverage) */
        private Map<String, Double> weights = new LinkedHashMap<>();
        private Map<String, Double> thresholds = new LinkedHashMap<>();
    }

    @Data
    public static class Keywords {
        private String source;

        void ensureDefaults() {
            if (source == null || source.isBlank()) {
                source = "classpath:sensitive-keywords.txt";
            }
        }
    }

    @Data
    public static class Sources {
        private String endpointsFile;
        private String trafficDirectory;
        private Elasticsearch elasticsearch;

        void ensureDefaults() {
            if (endpointsFile == null || endpointsFile.isBlank()) {
                endpointsFile = "endpoints.yaml";
            }
            if (trafficDirectory == null || trafficDirectory.isBlank()) {
                trafficDirectory = "traffic";
            }
            if (elasticsearch == null) {
                elasticsearch = new Elasticsearch();
            }
            elasticsearch.ensureDefaults();
        }
    }

    @Data
    public static class Elasticsearch {
        private static final int DEFAULT_PAGE_SIZE = 500;
        private static final int DEFAULT_MAX_ENTRIES = 50_000;
        private static final int DEFAULT_TIMEOUT_SEC = 10;
        private static final int DEFAULT_MAX_RETRIES = 2;
        private static final long DEFAULT_RETRY_DELAY_MS = 500L;

        private Boolean enabled;
        private String url;
        private String index;
        private String username;
        private String password;
        private Integer pageSize;
        private Integer maxEntries;
        private Integer connectTimeoutSec;
        private Integer readTimeoutSec;
        private Integer maxRetries;
        private Long retryDelayMs;
        private FieldMapping fields;

        void ensureDefaults() {
            if (enabled == null) {
                enabled = Boolean.FALSE;
            }
            if (url == null || url.isBlank()) {
                url = "http://localhost:9200";
            }
            if (index == null || index.isBlank()) {
                index = "api-traffic-*";
            }
            if (pageSize == null || pageSize <= 0) {
                pageSize = DEFAULT_PAGE_SIZE;
            }
            if (maxEntries == null || maxEntries <= 0) {
                maxEntries = DEFAULT_MAX_ENTRIES;
            }
            if (connectTimeoutSec == null || connectTimeoutSec <= 0) {
                connectTimeoutSec = DEFAULT_TIMEOUT_SEC;
            }
            if (readTimeoutSec == null || readTimeoutSec <= 0) {
                readTimeoutSec = DEFAULT_TIMEOUT_SEC;
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = DEFAULT_MAX_RETRIES;
            }
            if (retryDelayMs == null || retryDelayMs < 0) {
                retryDelayMs = DEFAULT_RETRY_DELAY_MS;
            }
            if (fields == null) {
                fields = new FieldMapping();
            }
            fields.ensureDefaults();
        }

        public boolean isEnabled() {
            return Boolean.TRUE.equals(enabled);
        }
    }

    /**
     * Имена полей документа журнала в индексе
     */
    @Data
    public static class FieldMapping {
        private String endpoint;
        private String timestamp;
        private String status;
        private String clientIp;
        private String scheme;
        private String headers;
        private String body;

        void ensureDefaults() {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = "endpoint_id";
            }
            if (timestamp == null || timestamp.isBlank()) {
                timestamp = "@timestamp";
            }
            if (status == null || status.isBlank()) {
                status = "status";
            }
            if (clientIp == null || clientIp.isBlank()) {
                clientIp = "client_ip";
            }
            if (scheme == null || scheme.isBlank()) {
                scheme = "scheme";
            }
            if (headers == null || headers.isBlank()) {
                headers = "request_headers";
            }
            if (body == null || body.isBlank()) {
                body = "request_body";
            }
        }
    }

    @Data
    public static class Dashboard {
        private Integer defaultRangeDays;
        private Integer maxRangeDays;
        private Integer sensitiveSampleSize;
        private Integer parallelism;

        void ensureDefaults() {
            if (defaultRangeDays == null || defaultRangeDays <= 0) {
                defaultRangeDays = 7;
            }
            if (maxRangeDays == null || maxRangeDays <= 0) {
                maxRangeDays = 90;
            }
            if (sensitiveSampleSize == null || sensitiveSampleSize < 0) {
                sensitiveSampleSize = ScoringSettings.DEFAULT_SENSITIVE_SAMPLE_SIZE;
            }
            if (parallelism == null || parallelism <= 0) {
                parallelism = 4;
            }
        }
    }

    @Data
    public static class Share {
        private Integer ttlHours;

        void ensureDefaults() {
            if (ttlHours == null || ttlHours <= 0) {
                ttlHours = 168;
            }
        }
    }
}
