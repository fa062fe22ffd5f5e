package com.vtb.posture.service;

import com.vtb.posture.core.InvalidTimeRangeException;
import com.vtb.posture.core.MissingDataException;
import com.vtb.posture.core.SecurityScoringEngine;
import com.vtb.posture.core.TrafficAnomalyAnalyzer;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.PortfolioSummary;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficSample;
import com.vtb.posture.models.TrafficTimeline;
import com.vtb.posture.reports.PortfolioSummaryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Прикладной сервис: проверяет период, загружает конфигурацию и журнал,
 * запускает движок и упаковывает результат в {@link ScoreReport}.
 *
 * Отказ хранилища журналов не прерывает оценку: эндпоинт оценивается
 * как не имеющий выборки трафика, соответствующие компоненты получают минимум.
 */
@Slf4j
public class PostureScoringService implements AutoCloseable {

    private final SecurityScoringEngine engine;
    private final EndpointConfigSource configSource;
    private final TrafficLogSource trafficSource;
    private final Clock clock;
    private final int defaultRangeDays;
    private final int maxRangeDays;
    private final ExecutorService executor;
    private final PortfolioSummaryBuilder summaryBuilder = new PortfolioSummaryBuilder();

    public PostureScoringService(SecurityScoringEngine engine,
                                 EndpointConfigSource configSource,
                                 TrafficLogSource trafficSource,
                                 Clock clock,
                                 int defaultRangeDays,
                                 int maxRangeDays,
                                 int parallelism) {
        this.engine = engine;
        this.configSource = configSource;
        this.trafficSource = trafficSource;
        this.clock = clock;
        this.defaultRangeDays = defaultRangeDays;
        this.maxRangeDays = maxRangeDays;
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), new ScoringThreadFactory());
    }

    /**
     * Последние defaultRangeDays дней, включая сегодняшний (UTC)
     */
    public TimeRange defaultRange() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return TimeRange.of(today.minusDays(defaultRangeDays - 1L), today);
    }

    /**
     * Период из параметров запроса; без обоих параметров берется период по умолчанию
     *
     * @throws InvalidTimeRangeException если задана только одна граница или формат неверен
     */
    public TimeRange resolveRange(String start, String end) {
        if ((start == null || start.isBlank()) && (end == null || end.isBlank())) {
            return defaultRange();
        }
        return validate(TimeRange.parse(start, end));
    }

    /**
     * @throws InvalidTimeRangeException если период длиннее maxRangeDays
     */
    public TimeRange validate(TimeRange range) {
        if (range == null) {
            throw new InvalidTimeRangeException("Период анализа не задан");
        }
        if (range.lengthInDays() > maxRangeDays) {
            throw new InvalidTimeRangeException("Период " + range.lengthInDays()
                + " дней превышает максимум " + maxRangeDays);
        }
        return range;
    }

    public List<EndpointConfig> listEndpoints() {
        return configSource.findAll();
    }

    /**
     * @throws MissingDataException если эндпоинт не найден
     */
    public EndpointConfig endpoint(String endpointId) {
        return configSource.findById(endpointId)
            .orElseThrow(() -> new MissingDataException(endpointId, "Эндпоинт не найден: " + endpointId));
    }

    /**
     * Динамика трафика эндпоинта. Период и интервал проверяются до обращения к журналу.
     *
     * @throws InvalidTimeRangeException при неверном периоде
     * @throws IllegalArgumentException при неверном интервале
     * @throws MissingDataException если эндпоинт не найден
     */
    public TrafficTimeline timeline(String endpointId, TimeRange range, String interval) {
        validate(range);
        TrafficAnomalyAnalyzer.parseInterval(interval);
        EndpointConfig config = endpoint(endpointId);
        TrafficTimeline timeline = engine.timeline(config, loadTraffic(config, range), range, interval);
        log.info("Динамика {} за {}..{} по {}: {} точек", endpointId, range.getStart(), range.getEnd(),
            interval, timeline.getPoints().size());
        return timeline;
    }

    /**
     * Оценить один эндпоинт
     *
     * @throws InvalidTimeRangeException при неверном периоде (до обращения к данным)
     * @throws MissingDataException если эндпоинт не найден
     */
    public ScoreReport score(String endpointId, TimeRange range) {
        validate(range);
        return score(endpoint(endpointId), range);
    }

    private ScoreReport score(EndpointConfig config, TimeRange range) {
        TrafficSample sample = loadTraffic(config, range);
        CompositeScoreResult result = engine.score(config, sample, range);
        log.info("Эндпоинт {} оценен: {} ({})", config.getId(), result.getOverallScore(), result.getLevel());
        return ScoreReport.builder()
            .endpointId(config.getId())
            .endpointName(config.displayName())
            .timeRange(range)
            .generatedAt(clock.instant())
            .keywordSetVersion(result.getSensitiveData() != null
                ? result.getSensitiveData().getKeywordSetVersion() : 0L)
            .result(result)
            .build();
    }

    private TrafficSample loadTraffic(EndpointConfig config, TimeRange range) {
        try {
            return trafficSource.fetch(config.getId(), range, config.zoneId());
        } catch (TrafficSourceException e) {
            log.warn("Журнал трафика {} недоступен, оценка без выборки: {}", config.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * Оценить все эндпоинты параллельно и собрать сводку.
     * Ошибка одного эндпоинта не прерывает остальные.
     */
    public PortfolioSummary scoreAll(TimeRange range) {
        validate(range);
        List<EndpointConfig> configs = configSource.findAll();
        log.info("Оценка {} эндпоинтов за {}..{}", configs.size(), range.getStart(), range.getEnd());

        Map<String, Future<ScoreReport>> futures = new LinkedHashMap<>();
        for (EndpointConfig config : configs) {
            futures.put(config.getId(), executor.submit(() -> score(config, range)));
        }

        List<ScoreReport> reports = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, Future<ScoreReport>> entry : futures.entrySet()) {
            try {
                reports.add(entry.getValue().get());
            } catch (ExecutionException e) {
                log.error("Эндпоинт {} не оценен: {}", entry.getKey(), e.getCause().getMessage());
                failed.add(entry.getKey());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Оценка прервана", e);
            }
        }
        return summaryBuilder.build(reports, failed, range, clock.instant());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class ScoringThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "posture-scoring-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
