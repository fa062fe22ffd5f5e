package com.vtb.posture.core;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficSample;
import com.vtb.posture.models.TrafficStats;
import com.vtb.posture.models.TrafficTimeline;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Главный движок оценки защищенности эндпоинта.
 *
 * Конвейер: факты -> анализ трафика -> поиск чувствительных данных ->
 * девять скореров -> агрегирование -> рекомендации.
 * Не выполняет ввод-вывод и не читает системное время, поэтому одинаковые
 * входные данные дают одинаковый результат. Потокобезопасен.
 */
@Slf4j
public class SecurityScoringEngine {

    private final ScoringSettings settings;
    private final Supplier<SensitiveKeywordSet> keywords;
    private final FactExtractor factExtractor;
    private final TrafficAnomalyAnalyzer anomalyAnalyzer;
    private final SensitiveDataScanner sensitiveDataScanner;
    private final RecommendationGenerator recommendationGenerator;

    public SecurityScoringEngine(ScoringSettings settings, Supplier<SensitiveKeywordSet> keywords) {
        this.settings = settings;
        this.keywords = keywords;
        this.factExtractor = new FactExtractor(settings);
        this.anomalyAnalyzer = new TrafficAnomalyAnalyzer(settings);
        this.sensitiveDataScanner = new SensitiveDataScanner();
        this.recommendationGenerator = new RecommendationGenerator();
    }

    /**
     * Оценить эндпоинт по текущему набору ключевых слов
     *
     * @param config конфигурация эндпоинта
     * @param sample выборка трафика за период; null, если журнал недоступен
     * @param range период анализа
     * @throws MissingDataException если конфигурация отсутствует
     * @throws InvalidTimeRangeException если период не задан
     */
    public CompositeScoreResult score(EndpointConfig config, TrafficSample sample, TimeRange range) {
        return score(config, sample, range, keywords.get());
    }

    /**
     * Динамика трафика эндпоинта по интервалам
     *
     * @param sample выборка за период; null, если журнал недоступен
     * @throws MissingDataException если конфигурация отсутствует
     * @throws IllegalArgumentException если интервал задан неверно
     */
    public TrafficTimeline timeline(EndpointConfig config, TrafficSample sample, TimeRange range, String interval) {
        if (config == null) {
            throw new MissingDataException(null, "Конфигурация эндпоинта отсутствует");
        }
        if (range == null) {
            throw new InvalidTimeRangeException("Период анализа не задан");
        }
        return anomalyAnalyzer.timeline(config.getId(), sample, range, config.zoneId(), interval);
    }

    /**
     * Оценить эндпоинт с явно переданным снимком ключевых слов
     */
    public CompositeScoreResult score(EndpointConfig config, TrafficSample sample, TimeRange range,
                                      SensitiveKeywordSet keywordSet) {
        EndpointFacts facts = factExtractor.extract(config, sample, range);
        log.debug("Оценка {}: {} записей в периоде {}..{}, словарь v{}",
            facts.getEndpointId(), facts.getTotalRequests(), range.getStart(), range.getEnd(),
            keywordSet != null ? keywordSet.getVersion() : 0);

        TrafficStats traffic = anomalyAnalyzer.analyze(
            facts.getTraffic(), range, facts.getZone(), facts.isTrafficAvailable());
        SensitiveDataFinding sensitiveData = sensitiveDataScanner.scan(
            facts.getTraffic(), keywordSet, settings.getSensitiveSampleSize());

        ComponentScorers.Input input = new ComponentScorers.Input(facts, traffic, sensitiveData, settings);
        List<ComponentScore> components = new ArrayList<>(ScoreComponent.values().length);
        for (ScoreComponent component : ScoreComponent.values()) {
            components.add(ComponentScorers.evaluate(component, input));
        }

        double overall = ScoreAggregator.composite(components);
        List<Recommendation> recommendations =
            recommendationGenerator.generate(components, facts, traffic, sensitiveData);

        log.debug("Оценка {}: {} ({}), рекомендаций: {}",
            facts.getEndpointId(), overall, ScoreAggregator.level(overall), recommendations.size());

        return CompositeScoreResult.builder()
            .overallScore(overall)
            .level(ScoreAggregator.level(overall))
            .components(List.copyOf(components))
            .trafficStats(traffic)
            .sensitiveData(sensitiveData)
            .recommendations(recommendations)
            .build();
    }

    public ScoringSettings getSettings() {
        return settings;
    }
}
