package com.vtb.posture.core;

import com.vtb.posture.models.EndpointConfig;
import com.vtb.posture.models.ThrottlingRule;
import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Приводит сырую конфигурацию и журнал трафика к набору фактов для скореров
 */
@Slf4j
public class FactExtractor {

    private static final int SAMPLE_LIMIT = 5;

    private final ScoringSettings settings;

    public FactExtractor(ScoringSettings settings) {
        this.settings = settings;
    }

    /**
     * @param config конфигурация эндпоинта (обязательна)
     * @param sample выборка трафика; null означает, что журнал недоступен
     * @param range период анализа
     * @throws MissingDataException если конфигурация отсутствует
     */
    public EndpointFacts extract(EndpointConfig config, TrafficSample sample, TimeRange range) {
        if (config == null) {
            throw new MissingDataException(null, "Конфигурация эндпоинта не найдена");
        }
        if (range == null) {
            throw new InvalidTimeRangeException("Период анализа не задан");
        }

        ZoneId zone = config.zoneId();
        boolean trafficAvailable = sample != null;
        TrafficSample inRange = trafficAvailable ? filterToRange(sample, range, zone) : TrafficSample.empty();
        long dropped = trafficAvailable ? sample.size() - inRange.size() : 0;
        if (dropped > 0) {
            log.debug("Эндпоинт {}: отброшено {} записей вне периода {}..{}",
                config.getId(), dropped, range.getStart(), range.getEnd());
        }

        EndpointFacts.EndpointFactsBuilder facts = EndpointFacts.builder()
            .endpointId(config.getId())
            .endpointName(config.displayName())
            .zone(zone)
            .trafficAvailable(trafficAvailable)
            .totalRequests(inRange.size())
            .droppedOutOfRange(dropped)
            .traffic(inRange);

        extractWhitelist(config, inRange, facts);
        extractThrottling(config, facts);

        facts.quotaPresent(config.getQuota() != null && config.getQuota().active());
        facts.authMethod(config.getAuthMethod());
        facts.allowedHoursPresent(config.getAllowedHours() != null && config.getAllowedHours().restricted());
        facts.alwaysOpenJustified(config.isAlwaysOpenJustified());

        extractTransport(config, inRange, facts);

        return facts.build();
    }

    private TrafficSample filterToRange(TrafficSample sample, TimeRange range, ZoneId zone) {
        List<TrafficEntry> kept = new ArrayList<>(sample.size());
        for (TrafficEntry entry : sample.getEntries()) {
            // Записи без времени не отбрасываем: они не попадут в гистограмму, но участвуют в сканировании
            if (entry.getTimestamp() == null || range.contains(entry.getTimestamp(), zone)) {
                kept.add(entry);
            }
        }
        return kept.size() == sample.size() ? sample : TrafficSample.of(kept, sample.isTruncated());
    }

    private void extractWhitelist(EndpointConfig config, TrafficSample traffic,
                                  EndpointFacts.EndpointFactsBuilder facts) {
        List<String> whitelist = config.getWhitelist() != null ? config.getWhitelist() : List.of();
        int entries = (int) whitelist.stream().filter(e -> e != null && !e.isBlank()).count();

        TreeSet<String> observed = new TreeSet<>();
        for (TrafficEntry entry : traffic.getEntries()) {
            String ip = sourceIp(entry);
            if (ip != null) {
                observed.add(ip);
            }
        }

        IpMatcher matcher = IpMatcher.of(whitelist);
        List<String> uncovered = new ArrayList<>();
        for (String ip : observed) {
            if (!matcher.matches(ip)) {
                uncovered.add(ip);
            }
        }

        facts.whitelistEntries(entries)
            .observedSourceIps(observed.size())
            .uncoveredSourceIps(uncovered.size())
            .uncoveredSamples(List.copyOf(uncovered.subList(0, Math.min(SAMPLE_LIMIT, uncovered.size()))));
    }

    private void extractThrottling(EndpointConfig config, EndpointFacts.EndpointFactsBuilder facts) {
        ThrottlingRule rule = config.getThrottling();
        boolean present = rule != null && rule.active();
        boolean bounded = present && rule.bounded();
        double safe = config.getSafeThrottleRatePerHour() != null && config.getSafeThrottleRatePerHour() > 0
            ? config.getSafeThrottleRatePerHour()
            : settings.getSafeThrottleRatePerHour();
        facts.throttlePresent(present)
            .throttleBounded(bounded)
            .throttleRatePerHour(bounded ? rule.ratePerHour() : 0.0)
            .safeThrottleRatePerHour(safe);
    }

    private void extractTransport(EndpointConfig config, TrafficSample traffic,
                                  EndpointFacts.EndpointFactsBuilder facts) {
        long https = 0;
        long http = 0;
        for (TrafficEntry entry : traffic.getEntries()) {
            Boolean secure = entry.secure();
            if (Boolean.TRUE.equals(secure)) {
                https++;
            } else if (Boolean.FALSE.equals(secure)) {
                http++;
            }
        }

        List<String> backends = config.getBackendAddresses() != null ? config.getBackendAddresses() : List.of();
        int total = 0;
        int secure = 0;
        List<String> insecure = new ArrayList<>();
        for (String address : backends) {
            if (address == null || address.isBlank()) {
                continue;
            }
            total++;
            if (address.trim().toLowerCase(Locale.ROOT).startsWith("https://")) {
                secure++;
            } else if (insecure.size() < SAMPLE_LIMIT) {
                insecure.add(address.trim());
            }
        }

        facts.clientSsl(config.getClientSsl())
            .backendSsl(config.getBackendSsl())
            .httpsEntries(https)
            .httpEntries(http)
            .backendAddresses(total)
            .secureBackendAddresses(secure)
            .insecureBackends(List.copyOf(insecure));
    }

    /**
     * IP клиента: поле записи, иначе первый адрес из X-Forwarded-For
     */
    static String sourceIp(TrafficEntry entry) {
        if (entry.getSourceIp() != null && !entry.getSourceIp().isBlank()) {
            return entry.getSourceIp().trim();
        }
        String forwarded = entry.header("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            return first.isEmpty() ? null : first;
        }
        return null;
    }
}
