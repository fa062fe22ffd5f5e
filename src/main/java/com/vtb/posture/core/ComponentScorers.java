package com.vtb.posture.core;

import com.vtb.posture.models.AuthMethod;
import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SecurityLevel;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.TrafficStats;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Девять чистых функций оценки, по одной на компонент.
 *
 * Каждая функция тотальна: при нехватке фактов возвращает минимальную оценку
 * и записывает причину в факты, исключения наружу не выходят.
 */
@Slf4j
public final class ComponentScorers {

    static final double CLIENT_SSL_SHARE = 0.6;
    static final double BACKEND_SSL_SHARE = 0.4;

    private ComponentScorers() {
    }

    /**
     * Входные данные одного прогона: факты и результаты обоих анализаторов
     */
    public static final class Input {
        private final EndpointFacts facts;
        private final TrafficStats traffic;
        private final SensitiveDataFinding sensitiveData;
        private final ScoringSettings settings;

        public Input(EndpointFacts facts, TrafficStats traffic,
                     SensitiveDataFinding sensitiveData, ScoringSettings settings) {
            this.facts = facts;
            this.traffic = traffic;
            this.sensitiveData = sensitiveData;
            this.settings = settings;
        }
    }

    public static ComponentScore evaluate(ScoreComponent component, Input input) {
        Verdict verdict;
        try {
            verdict = switch (component) {
                case IP_WHITELIST -> ipWhitelist(input.facts);
                case THROTTLING -> throttling(input.facts);
                case QUOTA -> quota(input.facts);
                case AUTHENTICATION -> authentication(input.facts);
                case ALLOWED_HOURS -> allowedHours(input.facts);
                case TRAFFIC_ANOMALY -> trafficAnomaly(input.traffic, input.settings);
                case ERROR_RATE -> errorRate(input.traffic, input.settings);
                case SSL_TLS -> sslTls(input.facts);
                case LOGGING -> logging(input.sensitiveData);
            };
        } catch (RuntimeException e) {
            log.warn("Компонент {} не оценен, выставлен минимум: {}", component.getId(), e.getMessage());
            verdict = Verdict.degraded("evaluation failed: " + e.getClass().getSimpleName());
        }

        double score = Scores.round2(Scores.clamp(verdict.score));
        double weight = input.settings.weight(component);
        return ComponentScore.builder()
            .component(component)
            .name(component.getDisplayName())
            .score(score)
            .weight(weight)
            .contribution(Scores.round2(score * weight))
            .threshold(input.settings.threshold(component))
            .level(SecurityLevel.fromScore(score))
            .degraded(verdict.degraded)
            .facts(Collections.unmodifiableMap(verdict.facts))
            .build();
    }

    // ------------------------------------------------------------------
    // Таблицы, проверяемые напрямую
    // ------------------------------------------------------------------

    /**
     * Неизвестный или отсутствующий метод трактуется как NONE
     */
    public static double authenticationScore(AuthMethod method) {
        return (method != null ? method : AuthMethod.NONE).getStrength();
    }

    /**
     * Ступени по доле записей с чувствительными данными.
     * Первая подходящая ступень при проверке по возрастанию процента.
     */
    public static double loggingScore(double matchPercentage) {
        if (matchPercentage <= 0.0) {
            return 100;
        }
        if (matchPercentage <= 1.0) {
            return 80;
        }
        if (matchPercentage <= 5.0) {
            return 70;
        }
        if (matchPercentage <= 10.0) {
            return 60;
        }
        if (matchPercentage <= 20.0) {
            return 50;
        }
        if (matchPercentage <= 50.0) {
            return 40;
        }
        if (matchPercentage <= 80.0) {
            return 20;
        }
        return 10;
    }

    /**
     * 100 при 0% ошибок, линейно до 0 на потолке
     */
    public static double errorRateScore(double errorRate, double ceiling) {
        if (ceiling <= 0) {
            return errorRate > 0 ? 0 : 100;
        }
        return Scores.clamp(100.0 * (1.0 - errorRate / ceiling));
    }

    public static double anomalyScore(int anomalousBuckets, double penaltyPerBucket) {
        return Math.max(0.0, 100.0 - penaltyPerBucket * Math.max(0, anomalousBuckets));
    }

    // ------------------------------------------------------------------
    // Скореры
    // ------------------------------------------------------------------

    private static Verdict ipWhitelist(EndpointFacts facts) {
        Verdict verdict = new Verdict();
        verdict.fact("whitelist_entries", facts.getWhitelistEntries());
        verdict.fact("observed_source_ips", facts.getObservedSourceIps());
        verdict.fact("uncovered_source_ips", facts.getUncoveredSourceIps());

        if (facts.getWhitelistEntries() == 0) {
            verdict.fact("reason", "whitelist not configured");
            return verdict.score(0);
        }
        if (facts.getObservedSourceIps() == 0) {
            verdict.fact("reason", "no source IPs observed");
            return verdict.score(100);
        }
        int covered = facts.getObservedSourceIps() - facts.getUncoveredSourceIps();
        verdict.fact("coverage", Scores.format(100.0 * covered / facts.getObservedSourceIps()) + "%");
        return verdict.score(100.0 * covered / facts.getObservedSourceIps());
    }

    private static Verdict throttling(EndpointFacts facts) {
        Verdict verdict = new Verdict();
        verdict.fact("throttle_configured", facts.isThrottlePresent());
        if (!facts.isThrottlePresent()) {
            return verdict.score(0);
        }
        verdict.fact("safe_rate_per_hour", Scores.format(facts.getSafeThrottleRatePerHour()));
        if (!facts.isThrottleBounded()) {
            verdict.fact("reason", "throttle rule is unbounded");
            return verdict.score(50);
        }
        verdict.fact("rate_per_hour", Scores.format(facts.getThrottleRatePerHour()));
        if (facts.getThrottleRatePerHour() <= facts.getSafeThrottleRatePerHour()) {
            return verdict.score(100);
        }
        verdict.fact("reason", "throttle rule is more permissive than the safe rate");
        return verdict.score(50);
    }

    private static Verdict quota(EndpointFacts facts) {
        Verdict verdict = new Verdict();
        verdict.fact("quota_configured", facts.isQuotaPresent());
        return verdict.score(facts.isQuotaPresent() ? 100 : 0);
    }

    private static Verdict authentication(EndpointFacts facts) {
        if (facts.getAuthMethod() == null) {
            Verdict verdict = Verdict.degraded("auth method missing");
            verdict.fact("auth_method", AuthMethod.NONE.name());
            return verdict;
        }
        Verdict verdict = new Verdict();
        verdict.fact("auth_method", facts.getAuthMethod().name());
        return verdict.score(authenticationScore(facts.getAuthMethod()));
    }

    private static Verdict allowedHours(EndpointFacts facts) {
        Verdict verdict = new Verdict();
        verdict.fact("restricted_window", facts.isAllowedHoursPresent());
        verdict.fact("always_open_justified", facts.isAlwaysOpenJustified());
        return verdict.score(facts.isAllowedHoursPresent() || facts.isAlwaysOpenJustified() ? 100 : 0);
    }

    private static Verdict trafficAnomaly(TrafficStats traffic, ScoringSettings settings) {
        if (traffic == null || !traffic.isTrafficAvailable()) {
            return Verdict.degraded("traffic sample unavailable");
        }
        Verdict verdict = new Verdict();
        verdict.fact("anomalous_hours", traffic.anomalyCount());
        verdict.fact("threshold", Scores.format(traffic.getAnomalyThreshold()));
        if (traffic.isSampleTruncated()) {
            verdict.fact("sample_truncated", true);
        }
        if (traffic.getTotalRequests() == 0) {
            verdict.fact("reason", "no traffic observed");
        }
        return verdict.score(anomalyScore(traffic.anomalyCount(), settings.getAnomalyPenaltyPerBucket()));
    }

    private static Verdict errorRate(TrafficStats traffic, ScoringSettings settings) {
        if (traffic == null || !traffic.isTrafficAvailable()) {
            return Verdict.degraded("traffic sample unavailable");
        }
        Verdict verdict = new Verdict();
        verdict.fact("error_rate", Scores.format(traffic.getErrorRate()) + "%");
        verdict.fact("error_count", traffic.getErrorCount());
        verdict.fact("ceiling", Scores.format(settings.getErrorRateCeiling()) + "%");
        if (traffic.isSampleTruncated()) {
            verdict.fact("sample_truncated", true);
        }
        if (traffic.getTotalRequests() == 0) {
            verdict.fact("reason", "no traffic observed");
        }
        return verdict.score(errorRateScore(traffic.getErrorRate(), settings.getErrorRateCeiling()));
    }

    private static Verdict sslTls(EndpointFacts facts) {
        Verdict verdict = new Verdict();

        double client;
        if (facts.getClientSsl() == null) {
            verdict.markDegraded("client SSL status unknown");
            client = 0;
        } else if (!facts.getClientSsl()) {
            client = 0;
        } else {
            long known = facts.getHttpsEntries() + facts.getHttpEntries();
            client = known == 0 ? 100 : 100.0 * facts.getHttpsEntries() / known;
            if (facts.getHttpEntries() > 0) {
                verdict.fact("plain_http_requests", facts.getHttpEntries());
            }
        }

        double backend;
        if (facts.getBackendAddresses() > 0) {
            backend = 100.0 * facts.getSecureBackendAddresses() / facts.getBackendAddresses();
            verdict.fact("secure_backends", facts.getSecureBackendAddresses() + "/" + facts.getBackendAddresses());
        } else if (facts.getBackendSsl() == null) {
            verdict.markDegraded("backend SSL status unknown");
            backend = 0;
        } else {
            backend = facts.getBackendSsl() ? 100 : 0;
        }

        verdict.fact("client_ssl_score", Scores.format(client));
        verdict.fact("backend_ssl_score", Scores.format(backend));
        return verdict.score(CLIENT_SSL_SHARE * client + BACKEND_SSL_SHARE * backend);
    }

    private static Verdict logging(SensitiveDataFinding finding) {
        Verdict verdict = new Verdict();
        if (finding == null || finding.isNoData()) {
            verdict.fact("reason", "no data");
            verdict.fact("scanned_entries", 0);
            return verdict.score(100);
        }
        verdict.fact("scanned_entries", finding.getScannedEntries());
        verdict.fact("matching_entries", finding.getMatchingEntries());
        verdict.fact("match_percentage", Scores.format(finding.getMatchPercentage()) + "%");
        return verdict.score(loggingScore(finding.getMatchPercentage()));
    }

    /**
     * Промежуточный итог скорера: число, флаг деградации и факты в порядке добавления
     */
    private static final class Verdict {
        private double score;
        private boolean degraded;
        private final Map<String, String> facts = new LinkedHashMap<>();

        static Verdict degraded(String reason) {
            Verdict verdict = new Verdict();
            verdict.markDegraded(reason);
            return verdict.score(0);
        }

        Verdict score(double value) {
            this.score = value;
            return this;
        }

        void markDegraded(String reason) {
            this.degraded = true;
            facts.merge("degraded", reason, (a, b) -> a + "; " + b);
        }

        void fact(String key, Object value) {
            facts.put(key, String.valueOf(value));
        }
    }
}
