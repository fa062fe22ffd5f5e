package com.vtb.posture.core;

import com.vtb.posture.models.AllowedHoursWindow;
import com.vtb.posture.models.AuthMethod;
import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.QuotaRule;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.ThrottlingRule;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Общие тестовые данные: хорошо и плохо настроенные эндпоинты, ровный трафик
 */
public final class EndpointFixtures {

    public static final LocalDate START = LocalDate.of(2024, 3, 1);
    public static final LocalDate END = LocalDate.of(2024, 3, 7);

    private EndpointFixtures() {
    }

    public static TimeRange week() {
        return TimeRange.of(START, END);
    }

    public static SensitiveKeywordSet keywords(String... words) {
        return SensitiveKeywordSet.of(1L, "test", List.of(words));
    }

    /**
     * Все девять компонентов на максимуме
     */
    public static EndpointConfig hardened() {
        return EndpointConfig.builder()
            .id("payments")
            .name("Payments API")
            .whitelist(List.of("10.0.0.0/8"))
            .throttling(ThrottlingRule.builder().limit(100).windowSeconds(60).build())
            .quota(QuotaRule.builder().limit(100_000).build())
            .authMethod(AuthMethod.MTLS)
            .allowedHours(AllowedHoursWindow.builder().startHour(8).endHour(20).build())
            .clientSsl(true)
            .backendSsl(true)
            .backendAddresses(List.of("https://core.bank.local:8443"))
            .build();
    }

    /**
     * Ничего не настроено, метод аутентификации не указан
     */
    public static EndpointConfig bare() {
        return EndpointConfig.builder()
            .id("legacy")
            .name("Legacy API")
            .build();
    }

    public static TrafficEntry entry(Instant timestamp, int status, String ip) {
        return TrafficEntry.builder()
            .timestamp(timestamp)
            .status(status)
            .sourceIp(ip)
            .scheme("https")
            .headers(Map.of("Content-Type", "application/json"))
            .body("{\"amount\":100}")
            .build();
    }

    public static TrafficEntry entryWithBody(Instant timestamp, String body) {
        return TrafficEntry.builder()
            .timestamp(timestamp)
            .status(200)
            .sourceIp("10.0.0.1")
            .scheme("https")
            .body(body)
            .build();
    }

    public static Instant at(int day, int hour) {
        return START.plusDays(day).atTime(hour, 15).toInstant(ZoneOffset.UTC);
    }

    /**
     * Каждый день периода по {@code perHour} запросов в часы 08-19 UTC с трех адресов 10.0.0.x
     */
    public static TrafficSample businessHoursTraffic(int perHour) {
        List<TrafficEntry> entries = new ArrayList<>();
        for (int day = 0; day < 7; day++) {
            for (int hour = 8; hour < 20; hour++) {
                for (int i = 0; i < perHour; i++) {
                    entries.add(entry(at(day, hour), 200, "10.0.0." + (i % 3 + 1)));
                }
            }
        }
        return TrafficSample.of(entries);
    }
}
