package com.vtb.posture.web;

import com.vtb.posture.core.InvalidTimeRangeException;
import com.vtb.posture.core.MissingDataException;
import com.vtb.posture.keywords.ReloadOutcome;
import com.vtb.posture.keywords.SensitiveKeywordRegistry;
import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.PortfolioSummary;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficStats;
import com.vtb.posture.models.TrafficTimeline;
import com.vtb.posture.reports.ReportGenerator;
import com.vtb.posture.service.PostureScoringService;
import com.vtb.posture.share.ShareLink;
import com.vtb.posture.share.ShareLinkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API дашборда оценки защищенности.
 *
 * Период задается параметрами start/end (ISO даты), без них берутся последние дни
 * по настройке dashboard.defaultRangeDays. Ошибки: 400 неверный период,
 * 404 неизвестный эндпоинт или токен, 500 прочее; тело {"error": ...}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class PostureController {

    private final PostureScoringService scoringService;
    private final ShareLinkService shareLinkService;
    private final SensitiveKeywordRegistry keywordRegistry;

    public PostureController(PostureScoringService scoringService,
                             ShareLinkService shareLinkService,
                             SensitiveKeywordRegistry keywordRegistry) {
        this.scoringService = scoringService;
        this.shareLinkService = shareLinkService;
        this.keywordRegistry = keywordRegistry;
    }

    /**
     * GET /api/v1/endpoints
     */
    @GetMapping("/endpoints")
    public ResponseEntity<?> listEndpoints() {
        try {
            List<Map<String, Object>> endpoints = new ArrayList<>();
            for (EndpointConfig config : scoringService.listEndpoints()) {
                Map<String, Object> line = new LinkedHashMap<>();
                line.put("id", config.getId());
                line.put("name", config.displayName());
                line.put("authMethod", config.getAuthMethod());
                line.put("timeZone", config.zoneId().getId());
                endpoints.add(line);
            }
            return ResponseEntity.ok(endpoints);
        } catch (Exception e) {
            log.error("Ошибка получения списка эндпоинтов: {}", e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Конфигурация эндпоинта
     * GET /api/v1/endpoints/{id}
     */
    @GetMapping("/endpoints/{id}")
    public ResponseEntity<?> endpoint(@PathVariable("id") String endpointId) {
        try {
            return ResponseEntity.ok(scoringService.endpoint(endpointId));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка получения эндпоинта {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Динамика трафика по интервалам
     * GET /api/v1/endpoints/{id}/timeline?interval=1h&start=2024-01-01&end=2024-01-07
     */
    @GetMapping("/endpoints/{id}/timeline")
    public ResponseEntity<?> timeline(@PathVariable("id") String endpointId,
                                      @RequestParam(value = "interval", defaultValue = "1h") String interval,
                                      @RequestParam(value = "start", required = false) String start,
                                      @RequestParam(value = "end", required = false) String end) {
        try {
            TimeRange range = scoringService.resolveRange(start, end);
            TrafficTimeline timeline = scoringService.timeline(endpointId, range, interval);
            return ResponseEntity.ok(timeline);
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            // Сюда же попадает InvalidTimeRangeException
            log.warn("Неверные параметры динамики {}: {}", endpointId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка построения динамики {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Сводка по всем эндпоинтам
     * GET /api/v1/overview?start=2024-01-01&end=2024-01-07
     */
    @GetMapping("/overview")
    public ResponseEntity<?> overview(@RequestParam(value = "start", required = false) String start,
                                      @RequestParam(value = "end", required = false) String end) {
        try {
            TimeRange range = scoringService.resolveRange(start, end);
            PortfolioSummary summary = scoringService.scoreAll(range);
            return ResponseEntity.ok(summary);
        } catch (InvalidTimeRangeException e) {
            log.warn("Неверный период: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка построения сводки: {}", e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/endpoints/{id}/score
     */
    @GetMapping("/endpoints/{id}/score")
    public ResponseEntity<?> score(@PathVariable("id") String endpointId,
                                   @RequestParam(value = "start", required = false) String start,
                                   @RequestParam(value = "end", required = false) String end) {
        try {
            return ResponseEntity.ok(scoreReport(endpointId, start, end));
        } catch (InvalidTimeRangeException e) {
            log.warn("Неверный период: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка оценки {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/endpoints/{id}/sensitive-data
     */
    @GetMapping("/endpoints/{id}/sensitive-data")
    public ResponseEntity<?> sensitiveData(@PathVariable("id") String endpointId,
                                           @RequestParam(value = "start", required = false) String start,
                                           @RequestParam(value = "end", required = false) String end) {
        try {
            ScoreReport report = scoreReport(endpointId, start, end);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("endpointId", report.getEndpointId());
            body.put("timeRange", report.getTimeRange());
            body.put("keywordSetVersion", report.getKeywordSetVersion());
            body.put("finding", report.getResult().getSensitiveData());
            return ResponseEntity.ok(body);
        } catch (InvalidTimeRangeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка анализа чувствительных данных {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Почасовое распределение трафика с отметкой аномальных часов
     * GET /api/v1/endpoints/{id}/hourly-distribution
     */
    @GetMapping("/endpoints/{id}/hourly-distribution")
    public ResponseEntity<?> hourlyDistribution(@PathVariable("id") String endpointId,
                                                @RequestParam(value = "start", required = false) String start,
                                                @RequestParam(value = "end", required = false) String end) {
        try {
            ScoreReport report = scoreReport(endpointId, start, end);
            TrafficStats stats = report.getResult().getTrafficStats();

            List<Map<String, Object>> hours = new ArrayList<>();
            for (int hour = 0; hour < stats.getHourlyCounts().size(); hour++) {
                Map<String, Object> bucket = new LinkedHashMap<>();
                bucket.put("hour", hour);
                bucket.put("count", stats.getHourlyCounts().get(hour));
                bucket.put("anomalous", stats.getAnomalousHours().contains(hour));
                hours.add(bucket);
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("endpointId", report.getEndpointId());
            body.put("timeRange", report.getTimeRange());
            body.put("trafficAvailable", stats.isTrafficAvailable());
            body.put("totalRequests", stats.getTotalRequests());
            body.put("mean", stats.getMeanHourlyCount());
            body.put("stdDev", stats.getStdDevHourlyCount());
            body.put("threshold", stats.getAnomalyThreshold());
            body.put("hours", hours);
            return ResponseEntity.ok(body);
        } catch (InvalidTimeRangeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка построения распределения {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Скачать отчет
     * GET /api/v1/endpoints/{id}/export/{format}, format: json | pdf | html
     */
    @GetMapping("/endpoints/{id}/export/{format}")
    public ResponseEntity<?> export(@PathVariable("id") String endpointId,
                                    @PathVariable("format") String format,
                                    @RequestParam(value = "start", required = false) String start,
                                    @RequestParam(value = "end", required = false) String end) {
        try {
            ReportGenerator generator;
            try {
                generator = ReportGenerator.forFormat(format);
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
            ScoreReport report = scoreReport(endpointId, start, end);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            generator.write(report, out);

            String filename = generator.fileNameFor(report);
            return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType(generator.getContentType()))
                .body(out.toByteArray());
        } catch (InvalidTimeRangeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка экспорта {} в {}: {}", endpointId, format, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Создать share-ссылку на текущий отчет
     * POST /api/v1/endpoints/{id}/share
     */
    @PostMapping("/endpoints/{id}/share")
    public ResponseEntity<?> share(@PathVariable("id") String endpointId,
                                   @RequestParam(value = "start", required = false) String start,
                                   @RequestParam(value = "end", required = false) String end) {
        try {
            ShareLink link = shareLinkService.share(scoreReport(endpointId, start, end));
            return ResponseEntity.ok(link);
        } catch (InvalidTimeRangeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingDataException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка создания share-ссылки {}: {}", endpointId, e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/shared/{token}
     */
    @GetMapping("/shared/{token}")
    public ResponseEntity<?> shared(@PathVariable("token") String token) {
        try {
            Optional<ScoreReport> report = shareLinkService.resolve(token);
            if (report.isEmpty()) {
                return ResponseEntity.status(404).body(Map.of("error", "Ссылка не найдена или истекла"));
            }
            return ResponseEntity.ok(report.get());
        } catch (Exception e) {
            log.error("Ошибка чтения share-ссылки: {}", e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Перечитать словарь чувствительных данных
     * POST /api/v1/keywords/reload
     */
    @PostMapping("/keywords/reload")
    public ResponseEntity<?> reloadKeywords() {
        try {
            ReloadOutcome outcome = keywordRegistry.reload();
            if (!outcome.isSuccess()) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", outcome.getError());
                body.put("activeVersion", outcome.getActiveVersion());
                body.put("keywordCount", outcome.getKeywordCount());
                return ResponseEntity.status(500).body(body);
            }
            return ResponseEntity.ok(outcome);
        } catch (Exception e) {
            log.error("Ошибка перезагрузки словаря: {}", e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера: " + e.getMessage()));
        }
    }

    /**
     * Health check
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("service", "VTB API Security Posture Scorer");
        status.put("version", "1.0.0");
        SensitiveKeywordSet keywords = keywordRegistry.current();
        status.put("keywordSetVersion", keywords.getVersion());
        status.put("keywordCount", keywords.size());
        return ResponseEntity.ok(status);
    }

    private ScoreReport scoreReport(String endpointId, String start, String end) {
        TimeRange range = scoringService.resolveRange(start, end);
        return scoringService.score(endpointId, range);
    }
}
