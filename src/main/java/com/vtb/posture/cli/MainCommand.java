package com.vtb.posture.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vtb.posture.config.PostureConfig;
import com.vtb.posture.core.InvalidTimeRangeException;
import com.vtb.posture.core.MissingDataException;
import com.vtb.posture.core.SecurityScoringEngine;
import com.vtb.posture.keywords.KeywordSetLoadException;
import com.vtb.posture.keywords.SensitiveKeywordRegistry;
import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.CompositeScoreResult;
import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.PortfolioSummary;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.ScoreReport;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.reports.JsonReportGenerator;
import com.vtb.posture.reports.PortfolioSummaryBuilder;
import com.vtb.posture.reports.ReportGenerator;
import com.vtb.posture.service.PostureScoringService;
import com.vtb.posture.web.PostureBeans;
import com.vtb.posture.web.PostureWebApplication;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI оценщика защищенности API: оценка одного или всех эндпоинтов из файлов,
 * выгрузка отчетов и код возврата для CI/CD.
 *
 * Коды возврата: 0 успех, 1 оценка ниже --fail-below, 2 ошибка выполнения.
 */
@Slf4j
@Command(
    name = "api-posture",
    mixinStandardHelpOptions = true,
    version = "VTB API Security Posture Scorer 1.0.0",
    description = """

        VTB API Security Posture Scorer

        Оценка защищенности API по конфигурации эндпоинта и журналу трафика

        Возможности:
          • Взвешенная оценка по девяти компонентам (0-100)
          • Поиск чувствительных данных в заголовках и телах
          • Выявление аномалий трафика и доли ошибок
          • Отчеты JSON, PDF, HTML
          • Интеграция с CI/CD (--fail-below)

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_BELOW_THRESHOLD = 1;
    static final int EXIT_ERROR = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Внешний файл конфигурации YAML (по умолчанию posture-config.yaml из classpath)"
    )
    private Path configPath;

    @Option(
        names = {"-e", "--endpoint"},
        description = "Идентификатор эндпоинта (можно несколько; по умолчанию все)"
    )
    private List<String> endpointIds = new ArrayList<>();

    @Option(
        names = {"--start"},
        description = "Начало периода, yyyy-MM-dd"
    )
    private String start;

    @Option(
        names = {"--end"},
        description = "Конец периода включительно, yyyy-MM-dd"
    )
    private String end;

    @Option(
        names = {"--endpoints-file"},
        description = "Файл конфигураций эндпоинтов (переопределяет sources.endpointsFile)"
    )
    private String endpointsFile;

    @Option(
        names = {"--traffic-dir"},
        description = "Каталог журналов трафика *.jsonl (переопределяет sources.trafficDirectory)"
    )
    private String trafficDirectory;

    @Option(
        names = {"--keywords"},
        description = "Словарь чувствительных данных: путь к файлу или classpath:<ресурс>"
    )
    private String keywordsSource;

    @Option(
        names = {"-f", "--format"},
        split = ",",
        description = "Форматы отчетов через запятую: json, pdf, html (по умолчанию: json)"
    )
    private List<String> formats = new ArrayList<>(List.of("json"));

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"--fail-below"},
        description = "Вернуть код 1, если оценка любого эндпоинта ниже порога (для CI/CD)"
    )
    private Double failBelow;

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    @Option(
        names = {"--web"},
        description = "Запустить REST API дашборда (http://localhost:8080)"
    )
    private boolean webMode = false;

    @Option(
        names = {"--port"},
        description = "Порт для веб-режима (по умолчанию: 8080)"
    )
    private int webPort = 8080;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        printBanner();

        if (webMode) {
            if (configPath != null) {
                System.setProperty(PostureConfig.CONFIG_PROPERTY, configPath.toString());
            }
            log.info("Запуск REST API на порту {}...", webPort);
            PostureWebApplication.main(new String[]{"--server.port=" + webPort});
            return EXIT_OK;
        }

        try {
            PostureConfig config = configPath != null ? PostureConfig.loadFrom(configPath) : PostureConfig.load();
            applyOverrides(config);
            List<ReportGenerator> generators = resolveGenerators();

            PostureBeans beans = new PostureBeans();
            SensitiveKeywordRegistry registry = beans.sensitiveKeywordRegistry(config);
            SecurityScoringEngine engine = beans.securityScoringEngine(beans.scoringSettings(config), registry);
            Clock clock = Clock.systemUTC();

            try (PostureScoringService service = beans.postureScoringService(engine,
                    beans.endpointConfigSource(config), beans.trafficLogSource(config), clock, config)) {
                TimeRange range = service.resolveRange(start, end);
                List<String> ids = resolveEndpointIds(service);
                if (ids.isEmpty()) {
                    log.error("Не найдено ни одного эндпоинта в {}", config.getSources().getEndpointsFile());
                    return EXIT_ERROR;
                }

                Path outDir = Paths.get(outputDir);
                Files.createDirectories(outDir);

                List<ScoreReport> reports = new ArrayList<>();
                List<String> failed = new ArrayList<>();
                for (String id : ids) {
                    try {
                        ScoreReport report = service.score(id, range);
                        reports.add(report);
                        writeReports(report, generators, outDir);
                        printResult(report);
                    } catch (MissingDataException e) {
                        log.error("{}", e.getMessage());
                        failed.add(id);
                    }
                }

                if (ids.size() > 1) {
                    PortfolioSummary summary = new PortfolioSummaryBuilder()
                        .build(reports, failed, range, clock.instant());
                    writeSummary(summary, outDir);
                    printSummary(summary);
                }

                if (!failed.isEmpty()) {
                    return EXIT_ERROR;
                }
                return exitCodeFor(reports, failBelow);
            }
        } catch (InvalidTimeRangeException e) {
            log.error("Неверный период: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (KeywordSetLoadException e) {
            log.error("Словарь чувствительных данных не загружен ({}): {}", e.getSource(), e.getMessage());
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Ошибка оценки: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /**
     * 1, если хотя бы одна оценка строго ниже порога; без порога всегда 0
     */
    static int exitCodeFor(List<ScoreReport> reports, Double failBelow) {
        if (failBelow == null) {
            return EXIT_OK;
        }
        for (ScoreReport report : reports) {
            if (report.getResult().getOverallScore() < failBelow) {
                return EXIT_BELOW_THRESHOLD;
            }
        }
        return EXIT_OK;
    }

    private void applyOverrides(PostureConfig config) {
        if (endpointsFile != null) {
            config.getSources().setEndpointsFile(endpointsFile);
        }
        if (trafficDirectory != null) {
            config.getSources().setTrafficDirectory(trafficDirectory);
            // Явно заданный каталог важнее Elasticsearch из конфигурации
            config.getSources().getElasticsearch().setEnabled(false);
        }
        if (keywordsSource != null) {
            config.getKeywords().setSource(keywordsSource);
        }
    }

    private List<ReportGenerator> resolveGenerators() {
        Set<String> unique = new LinkedHashSet<>();
        for (String format : formats) {
            if (format != null && !format.isBlank()) {
                unique.add(format.trim().toLowerCase(Locale.ROOT));
            }
        }
        List<ReportGenerator> generators = new ArrayList<>();
        for (String format : unique) {
            generators.add(ReportGenerator.forFormat(format));
        }
        return generators;
    }

    private List<String> resolveEndpointIds(PostureScoringService service) {
        if (!endpointIds.isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(endpointIds));
        }
        List<String> ids = new ArrayList<>();
        for (EndpointConfig config : service.listEndpoints()) {
            ids.add(config.getId());
        }
        return ids;
    }

    private void writeReports(ScoreReport report, List<ReportGenerator> generators, Path outDir) throws IOException {
        for (ReportGenerator generator : generators) {
            Path target = outDir.resolve(generator.fileNameFor(report));
            generator.generate(report, target);
            log.info("Отчет сохранен: {}", target.toAbsolutePath());
        }
    }

    private void writeSummary(PortfolioSummary summary, Path outDir) throws IOException {
        ObjectMapper mapper = JsonReportGenerator.createMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Path target = outDir.resolve(String.format("posture-summary-%s_%s.json",
            summary.getTimeRange().getStart(), summary.getTimeRange().getEnd()));
        mapper.writeValue(target.toFile(), summary);
        log.info("Сводка сохранена: {}", target.toAbsolutePath());
    }

    private void printResult(ScoreReport report) {
        CompositeScoreResult result = report.getResult();
        if (ciMode) {
            System.out.printf(Locale.ROOT, "%s: %.2f (%s), рекомендаций: %d%n", report.getEndpointId(),
                result.getOverallScore(), result.getLevel().name(), result.getRecommendations().size());
            return;
        }
        System.out.println("\n" + "=".repeat(80));
        System.out.println("API SECURITY POSTURE: " + report.getEndpointName() + " (" + report.getEndpointId() + ")");
        System.out.println("=".repeat(80));
        System.out.println("Период: " + report.getTimeRange().getStart() + " .. " + report.getTimeRange().getEnd());
        System.out.printf(Locale.ROOT, "Итоговая оценка: %.2f / 100 (%s)%n",
            result.getOverallScore(), result.getLevel().getLabel());
        System.out.println();
        System.out.println("КОМПОНЕНТЫ:");
        for (ComponentScore component : result.getComponents()) {
            System.out.printf(Locale.ROOT, "   %-28s %6.2f  x %.2f = %5.2f%s%n",
                component.getName(), component.getScore(), component.getWeight(), component.getContribution(),
                component.isDegraded() ? "  (неполные данные)" : "");
        }
        if (!result.getRecommendations().isEmpty()) {
            System.out.println();
            System.out.println("РЕКОМЕНДАЦИИ:");
            for (Recommendation rec : result.getRecommendations()) {
                System.out.printf("   [%s] %s%n", rec.getSeverity().getCode(), rec.getTitle());
                System.out.printf("      → %s%n", rec.getAction());
            }
        }
        System.out.println("=".repeat(80));
    }

    private void printSummary(PortfolioSummary summary) {
        System.out.println();
        System.out.printf(Locale.ROOT, "Эндпоинтов оценено: %d из %d, средняя оценка: %.2f%n",
            summary.getScoredEndpoints(), summary.getTotalEndpoints(), summary.getAverageScore());
        System.out.println("По уровням: " + summary.getEndpointsByLevel());
        if (!summary.getFailedEndpoints().isEmpty()) {
            System.out.println("Не оценены: " + String.join(", ", summary.getFailedEndpoints()));
        }
        System.out.println("Отчеты сохранены в: " + outputDir);
    }

    private void printBanner() {
        if (ciMode) return;  // Не показываем в CI режиме

        System.out.println("""

            ╔═══════════════════════════════════════════════════════════╗
            ║                                                           ║
            ║     VTB API Security Posture Scorer v1.0.0                ║
            ║                                                           ║
            ║     Оценка защищенности API по конфигурации и трафику     ║
            ║                                                           ║
            ╚═══════════════════════════════════════════════════════════╝

            """);
    }
}
