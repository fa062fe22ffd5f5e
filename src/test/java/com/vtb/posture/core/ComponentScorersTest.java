package com.vtb.posture.core;

import com.vtb.posture.models.AuthMethod;
import com.vtb.posture.models.ComponentScore;
import com.vtb.posture.models.ScoreComponent;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.TrafficStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentScorersTest {

    private final ScoringSettings settings = ScoringSettings.defaults();

    @ParameterizedTest
    @CsvSource({
        "0.0, 100",
        "0.5, 80",
        "1.0, 80",
        "1.01, 70",
        "5.0, 70",
        "7.5, 60",
        "10.0, 60",
        "15.0, 50",
        "20.0, 50",
        "35.0, 40",
        "50.0, 40",
        "65.0, 20",
        "80.0, 20",
        "80.01, 10",
        "100.0, 10"
    })
    void loggingBands(double matchPercentage, double expected) {
        assertEquals(expected, ComponentScorers.loggingScore(matchPercentage));
    }

    @Test
    void authenticationStrengthTable() {
        assertEquals(0, ComponentScorers.authenticationScore(AuthMethod.NONE));
        assertEquals(40, ComponentScorers.authenticationScore(AuthMethod.API_KEY));
        assertEquals(50, ComponentScorers.authenticationScore(AuthMethod.BASIC));
        assertEquals(80, ComponentScorers.authenticationScore(AuthMethod.OAUTH));
        assertEquals(90, ComponentScorers.authenticationScore(AuthMethod.JWT));
        assertEquals(100, ComponentScorers.authenticationScore(AuthMethod.MTLS));
        assertEquals(0, ComponentScorers.authenticationScore(null));
    }

    @Test
    void errorRateIsLinearUpToCeiling() {
        assertEquals(100.0, ComponentScorers.errorRateScore(0.0, 20.0));
        assertEquals(50.0, ComponentScorers.errorRateScore(10.0, 20.0));
        assertEquals(0.0, ComponentScorers.errorRateScore(20.0, 20.0));
        assertEquals(0.0, ComponentScorers.errorRateScore(75.0, 20.0));
    }

    @Test
    void anomalyPenaltyPerBucket() {
        assertEquals(100.0, ComponentScorers.anomalyScore(0, 25));
        assertEquals(75.0, ComponentScorers.anomalyScore(1, 25));
        assertEquals(0.0, ComponentScorers.anomalyScore(4, 25));
        assertEquals(0.0, ComponentScorers.anomalyScore(9, 25));
    }

    @Test
    void emptyWhitelistScoresZero() {
        ComponentScore score = evaluate(ScoreComponent.IP_WHITELIST, facts().whitelistEntries(0).observedSourceIps(5));
        assertEquals(0.0, score.getScore());
        assertEquals("whitelist not configured", score.getFacts().get("reason"));
    }

    @Test
    void whitelistCoverageIsShareOfObservedIps() {
        ComponentScore full = evaluate(ScoreComponent.IP_WHITELIST,
            facts().whitelistEntries(2).observedSourceIps(4).uncoveredSourceIps(0));
        assertEquals(100.0, full.getScore());

        ComponentScore partial = evaluate(ScoreComponent.IP_WHITELIST,
            facts().whitelistEntries(2).observedSourceIps(4).uncoveredSourceIps(1));
        assertEquals(75.0, partial.getScore());
        assertEquals("75.00%", partial.getFacts().get("coverage"));

        ComponentScore quiet = evaluate(ScoreComponent.IP_WHITELIST, facts().whitelistEntries(1));
        assertEquals(100.0, quiet.getScore());
    }

    @Test
    void throttlingThreeLevels() {
        assertEquals(0.0, evaluate(ScoreComponent.THROTTLING, facts().throttlePresent(false)).getScore());
        assertEquals(100.0, evaluate(ScoreComponent.THROTTLING, facts()
            .throttlePresent(true).throttleBounded(true)
            .throttleRatePerHour(6000).safeThrottleRatePerHour(10_000)).getScore());
        assertEquals(50.0, evaluate(ScoreComponent.THROTTLING, facts()
            .throttlePresent(true).throttleBounded(true)
            .throttleRatePerHour(60_000).safeThrottleRatePerHour(10_000)).getScore());
        assertEquals(50.0, evaluate(ScoreComponent.THROTTLING, facts()
            .throttlePresent(true).throttleBounded(false).safeThrottleRatePerHour(10_000)).getScore());
    }

    @Test
    void missingAuthMethodIsDegradedToZero() {
        ComponentScore score = evaluate(ScoreComponent.AUTHENTICATION, facts().authMethod(null));
        assertEquals(0.0, score.getScore());
        assertTrue(score.isDegraded());
        assertEquals("auth method missing", score.getFacts().get("degraded"));

        ComponentScore jwt = evaluate(ScoreComponent.AUTHENTICATION, facts().authMethod(AuthMethod.JWT));
        assertEquals(90.0, jwt.getScore());
        assertFalse(jwt.isDegraded());
    }

    @Test
    void allowedHoursAcceptsJustifiedAlwaysOpen() {
        assertEquals(0.0, evaluate(ScoreComponent.ALLOWED_HOURS, facts()).getScore());
        assertEquals(100.0, evaluate(ScoreComponent.ALLOWED_HOURS, facts().allowedHoursPresent(true)).getScore());
        assertEquals(100.0, evaluate(ScoreComponent.ALLOWED_HOURS, facts().alwaysOpenJustified(true)).getScore());
    }

    @Test
    void sslBlendsClientAndBackend() {
        ComponentScore score = evaluate(ScoreComponent.SSL_TLS, facts()
            .clientSsl(true).httpsEntries(3).httpEntries(1)
            .backendAddresses(2).secureBackendAddresses(1));
        // 0.6 * 75 + 0.4 * 50
        assertEquals(65.0, score.getScore());
        assertEquals("1/2", score.getFacts().get("secure_backends"));
        assertFalse(score.isDegraded());

        ComponentScore flagsOnly = evaluate(ScoreComponent.SSL_TLS, facts().clientSsl(true).backendSsl(false));
        assertEquals(60.0, flagsOnly.getScore());
    }

    @Test
    void unknownSslStatusFailsClosed() {
        ComponentScore score = evaluate(ScoreComponent.SSL_TLS, facts().clientSsl(null).backendSsl(null));
        assertEquals(0.0, score.getScore());
        assertTrue(score.isDegraded());
        assertTrue(score.getFacts().get("degraded").contains("client SSL status unknown"));
        assertTrue(score.getFacts().get("degraded").contains("backend SSL status unknown"));
    }

    @Test
    void missingTrafficDegradesTrafficComponents() {
        TrafficStats unavailable = TrafficStats.builder().trafficAvailable(false).build();
        ComponentScorers.Input input = new ComponentScorers.Input(facts().build(), unavailable,
            SensitiveDataFinding.noData(1), settings);

        ComponentScore anomaly = ComponentScorers.evaluate(ScoreComponent.TRAFFIC_ANOMALY, input);
        ComponentScore errors = ComponentScorers.evaluate(ScoreComponent.ERROR_RATE, input);
        assertEquals(0.0, anomaly.getScore());
        assertTrue(anomaly.isDegraded());
        assertEquals(0.0, errors.getScore());
        assertTrue(errors.isDegraded());
    }

    @Test
    void emptyTrafficIsNeutral() {
        TrafficStats empty = TrafficStats.builder().trafficAvailable(true).totalRequests(0).build();
        ComponentScorers.Input input = new ComponentScorers.Input(facts().build(), empty,
            SensitiveDataFinding.noData(1), settings);

        ComponentScore anomaly = ComponentScorers.evaluate(ScoreComponent.TRAFFIC_ANOMALY, input);
        ComponentScore errors = ComponentScorers.evaluate(ScoreComponent.ERROR_RATE, input);
        ComponentScore logging = ComponentScorers.evaluate(ScoreComponent.LOGGING, input);
        assertEquals(100.0, anomaly.getScore());
        assertEquals("no traffic observed", anomaly.getFacts().get("reason"));
        assertEquals(100.0, errors.getScore());
        assertEquals(100.0, logging.getScore());
        assertEquals("no data", logging.getFacts().get("reason"));
    }

    @Test
    void truncatedSampleIsNotedInTrafficFacts() {
        TrafficStats stats = TrafficStats.builder().totalRequests(100).errorCount(5).errorRate(5.0)
            .sampleTruncated(true).build();
        ComponentScorers.Input input = new ComponentScorers.Input(facts().build(), stats,
            SensitiveDataFinding.noData(1), settings);

        assertEquals("true", ComponentScorers.evaluate(ScoreComponent.TRAFFIC_ANOMALY, input)
            .getFacts().get("sample_truncated"));
        assertEquals("true", ComponentScorers.evaluate(ScoreComponent.ERROR_RATE, input)
            .getFacts().get("sample_truncated"));

        ComponentScorers.Input complete = new ComponentScorers.Input(facts().build(),
            TrafficStats.builder().totalRequests(100).build(), SensitiveDataFinding.noData(1), settings);
        assertNull(ComponentScorers.evaluate(ScoreComponent.ERROR_RATE, complete).getFacts().get("sample_truncated"));
    }

    @Test
    void everyComponentCarriesWeightThresholdAndBoundedScore() {
        TrafficStats stats = TrafficStats.builder().totalRequests(10).errorRate(90.0).errorCount(9)
            .anomalousHours(List.of(1, 2, 3, 4, 5)).build();
        SensitiveDataFinding finding = SensitiveDataFinding.builder()
            .scannedEntries(10).matchingEntries(10).matchPercentage(100.0).keywordSetVersion(1).build();
        ComponentScorers.Input input = new ComponentScorers.Input(facts().build(), stats, finding, settings);

        for (ScoreComponent component : ScoreComponent.values()) {
            ComponentScore score = ComponentScorers.evaluate(component, input);
            assertTrue(score.getScore() >= 0 && score.getScore() <= 100, component + " вне диапазона");
            assertEquals(component.getDefaultWeight(), score.getWeight());
            assertEquals(component.getDefaultThreshold(), score.getThreshold());
            assertEquals(component.getDisplayName(), score.getName());
            assertEquals(Math.round(score.getScore() * score.getWeight() * 100) / 100.0, score.getContribution(), 1e-9);
        }
    }

    @Test
    void scorerFailureFailsClosedInsteadOfThrowing() {
        // Без фактов скорер падает внутри, наружу выходит минимальная оценка
        ComponentScorers.Input input = new ComponentScorers.Input(null, null, null, settings);
        ComponentScore score = ComponentScorers.evaluate(ScoreComponent.QUOTA, input);
        assertEquals(0.0, score.getScore());
        assertTrue(score.isDegraded());
        assertTrue(score.getFacts().get("degraded").startsWith("evaluation failed"));
    }

    private ComponentScore evaluate(ScoreComponent component, EndpointFacts.EndpointFactsBuilder facts) {
        ComponentScorers.Input input = new ComponentScorers.Input(facts.build(),
            TrafficStats.builder().build(), SensitiveDataFinding.noData(1), settings);
        return ComponentScorers.evaluate(component, input);
    }

    private static EndpointFacts.EndpointFactsBuilder facts() {
        return EndpointFacts.builder()
            .endpointId("test")
            .zone(ZoneOffset.UTC)
            .trafficAvailable(true);
    }
}
