package com.vtb.posture.core;

import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.KeywordHit;
import com.vtb.posture.models.Recommendation;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.Severity;
import com.vtb.posture.models.TrafficStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Рекомендации по компонентам с оценкой ниже порога.
 *
 * Ровно одна рекомендация на каждый такой компонент, тексты строятся
 * по фактам текущего прогона. Ничего не сохраняется между прогонами.
 */
public class RecommendationGenerator {

    static final double THROTTLE_HEADROOM = 1.2;
    private static final int TOP_KEYWORDS = 3;

    public List<Recommendation> generate(List<ComponentScore> components, EndpointFacts facts,
                                         TrafficStats traffic, SensitiveDataFinding sensitiveData) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ComponentScore score : components) {
            if (!score.belowThreshold()) {
                continue;
            }
            Severity severity = severityFor(score.getScore(), score.getThreshold());
            recommendations.add(build(score, severity, facts, traffic, sensitiveData));
        }
        recommendations.sort(Comparator
            .comparingInt((Recommendation r) -> r.getSeverity().getPriority()).reversed()
            .thenComparingInt(r -> r.getComponent().ordinal()));
        return List.copyOf(recommendations);
    }

    /**
     * Критичность по отношению оценки к порогу
     */
    public static Severity severityFor(double score, double threshold) {
        double ratio = threshold > 0 ? score / threshold : 1.0;
        if (ratio < 0.25) {
            return Severity.CRITICAL;
        }
        if (ratio < 0.5) {
            return Severity.HIGH;
        }
        if (ratio < 0.75) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private Recommendation build(ComponentScore score, Severity severity, EndpointFacts facts,
                                 TrafficStats traffic, SensitiveDataFinding sensitiveData) {
        Recommendation.RecommendationBuilder rec = Recommendation.builder()
            .severity(severity)
            .component(score.getComponent());

        switch (score.getComponent()) {
            case IP_WHITELIST -> {
                if (facts.getWhitelistEntries() == 0) {
                    rec.title("IP whitelist не настроен")
                        .description(String.format("Доступ к API открыт с любых адресов. За период замечено %d уникальных IP.",
                            facts.getObservedSourceIps()))
                        .action("Добавьте политику IP whitelist с адресами или подсетями известных клиентов");
                } else {
                    rec.title("IP whitelist не покрывает весь трафик")
                        .description(String.format("%d из %d адресов клиентов не входят в whitelist: %s",
                            facts.getUncoveredSourceIps(), facts.getObservedSourceIps(),
                            String.join(", ", facts.getUncoveredSamples())))
                        .action("Проверьте неизвестные адреса и добавьте легитимные в whitelist, остальные заблокируйте");
                }
            }
            case THROTTLING -> {
                long suggested = suggestedThrottle(traffic);
                String limit = suggested > 0 ? "~" + suggested + " запросов/час" : "по ожидаемой нагрузке";
                if (!facts.isThrottlePresent()) {
                    rec.title("Ограничение частоты запросов не настроено")
                        .description(String.format("Пиковая нагрузка %d запросов/час без троттлинга. Риск злоупотреблений и DoS.",
                            traffic != null ? traffic.getPeakRequestsPerHour() : 0))
                        .action("Добавьте политику троттлинга с лимитом " + limit);
                } else {
                    rec.title("Лимит троттлинга слишком мягкий")
                        .description(String.format("Действующий лимит %s запросов/час при безопасном значении %s",
                            facts.isThrottleBounded() ? Scores.format(facts.getThrottleRatePerHour()) : "без ограничения",
                            Scores.format(facts.getSafeThrottleRatePerHour())))
                        .action("Снизьте лимит троттлинга до " + limit);
                }
            }
            case QUOTA -> rec.title("Квота на использование API не настроена")
                .description(String.format("За период обработано %d запросов без ограничения объема.",
                    traffic != null ? traffic.getTotalRequests() : 0))
                .action("Добавьте квоту (запросов в день или месяц) для контроля нагрузки и справедливого использования");
            case AUTHENTICATION -> {
                String method = facts.getAuthMethod() != null ? facts.getAuthMethod().name() : "NONE";
                if (facts.getAuthMethod() == null || score.getScore() == 0) {
                    rec.title("Аутентификация не настроена")
                        .description("API доступен без аутентификации (метод: " + method + ")");
                } else {
                    rec.title("Слабый метод аутентификации")
                        .description("Используется " + method + ", оценка " + Scores.format(score.getScore()));
                }
                rec.action("Используйте OAuth2, JWT или mTLS вместо слабых схем");
            }
            case ALLOWED_HOURS -> {
                String window = suggestedWindow(traffic);
                rec.title("Доступ к API открыт круглосуточно")
                    .description(window != null
                        ? "Трафик сосредоточен в часах " + peakHoursText(traffic) + " (" + facts.getZone() + ")"
                        : "Ограничение по времени доступа не задано и не обосновано")
                    .action(window != null
                        ? "Ограничьте доступ окном " + window + " или отметьте эндпоинт как обоснованно открытый 24/7"
                        : "Задайте окно допустимых часов или отметьте эндпоинт как обоснованно открытый 24/7");
            }
            case TRAFFIC_ANOMALY -> {
                if (traffic == null || !traffic.isTrafficAvailable()) {
                    rec.title("Журнал трафика недоступен")
                        .description("Аномалии трафика не оценены: выборка за период не получена")
                        .action("Проверьте доступность хранилища журналов для этого эндпоинта");
                } else {
                    rec.title("Обнаружены всплески трафика")
                        .description(String.format("Аномальные часы: %s (порог %s запросов при среднем %s)",
                            hoursText(traffic.getAnomalousHours()), Scores.format(traffic.getAnomalyThreshold()),
                            Scores.format(traffic.getMeanHourlyCount())))
                        .action("Проверьте источники пиковой нагрузки и убедитесь, что троттлинг их ограничивает");
                }
            }
            case ERROR_RATE -> {
                if (traffic == null || !traffic.isTrafficAvailable()) {
                    rec.title("Журнал трафика недоступен")
                        .description("Доля ошибок не оценена: выборка за период не получена")
                        .action("Проверьте доступность хранилища журналов для этого эндпоинта");
                } else {
                    rec.title("Высокая доля ошибок")
                        .description(String.format("Доля ошибочных ответов %s%% (%d из %d)",
                            Scores.format(traffic.getErrorRate()), traffic.getErrorCount(), traffic.getTotalRequests()))
                        .action("Проверьте состояние бэкенда и частые причины ошибок, ошибки 4xx могут означать перебор");
                }
            }
            case SSL_TLS -> {
                StringBuilder description = new StringBuilder("Соединения без шифрования.");
                if (facts.getHttpEntries() > 0) {
                    description.append(" Запросов по HTTP: ").append(facts.getHttpEntries()).append('.');
                }
                if (!facts.getInsecureBackends().isEmpty()) {
                    description.append(" Бэкенды без TLS: ").append(String.join(", ", facts.getInsecureBackends())).append('.');
                }
                if (facts.getClientSsl() == null || (facts.getBackendAddresses() == 0 && facts.getBackendSsl() == null)) {
                    description.append(" Статус TLS известен не полностью.");
                }
                rec.title("Неполное шифрование SSL/TLS")
                    .description(description.toString())
                    .action("Включите HTTPS для клиентских соединений и соединений с бэкендом");
            }
            case LOGGING -> rec.title("Чувствительные данные в журналах")
                .description(String.format("%s%% записей содержат чувствительные данные (%d из %d). Чаще всего: %s",
                    Scores.format(sensitiveData.getMatchPercentage()), sensitiveData.getMatchingEntries(),
                    sensitiveData.getScannedEntries(), topKeywords(sensitiveData)))
                .action("Включите маскирование чувствительных полей в заголовках и теле перед записью в журнал");
        }
        return rec.build();
    }

    /**
     * Пиковая нагрузка за час с запасом 20%
     */
    static long suggestedThrottle(TrafficStats traffic) {
        if (traffic == null || traffic.getPeakRequestsPerHour() <= 0) {
            return 0;
        }
        return (long) (traffic.getPeakRequestsPerHour() * THROTTLE_HEADROOM);
    }

    /**
     * Окно от первого до последнего пикового часа включительно, например 09:00-18:00
     */
    static String suggestedWindow(TrafficStats traffic) {
        if (traffic == null || traffic.getPeakHours() == null || traffic.getPeakHours().isEmpty()) {
            return null;
        }
        int first = traffic.getPeakHours().get(0);
        int last = traffic.getPeakHours().get(traffic.getPeakHours().size() - 1);
        return String.format("%02d:00-%02d:00", first, last + 1);
    }

    private static String peakHoursText(TrafficStats traffic) {
        return hoursText(traffic.getPeakHours());
    }

    private static String hoursText(List<Integer> hours) {
        return hours.stream()
            .map(h -> String.format("%02d:00", h))
            .collect(Collectors.joining(", "));
    }

    private static String topKeywords(SensitiveDataFinding finding) {
        if (finding.getHits().isEmpty()) {
            return "-";
        }
        return finding.getHits().stream()
            .limit(TOP_KEYWORDS)
            .map(KeywordHit::getKeyword)
            .collect(Collectors.joining(", "));
    }
}
