package com.vtb.posture.models;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SecurityLevelTest {

    @ParameterizedTest
    @CsvSource({
        "100.0, EXCELLENT",
        "90.0, EXCELLENT",
        "89.99, GOOD",
        "75.0, GOOD",
        "74.99, FAIR",
        "60.0, FAIR",
        "59.99, POOR",
        "40.0, POOR",
        "39.99, CRITICAL",
        "0.0, CRITICAL"
    })
    void lowerBoundIsInclusive(double score, SecurityLevel expected) {
        assertEquals(expected, SecurityLevel.fromScore(score));
    }

    @ParameterizedTest
    @CsvSource({
        "mtls, MTLS",
        "Mutual-TLS, MTLS",
        "oauth2, OAUTH",
        "api-key, API_KEY",
        "jwt, JWT",
        "kerberos, NONE",
        "'', NONE"
    })
    void authMethodAliases(String value, AuthMethod expected) {
        assertEquals(expected, AuthMethod.parse(value));
    }
}
