package com.vtb.posture.core;

import com.vtb.posture.models.TimeRange;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import com.vtb.posture.models.TrafficStats;
import com.vtb.posture.models.TrafficTimeline;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Почасовая гистограмма трафика, доля ошибок и выбросы.
 *
 * Корзины строятся по часу суток (0-23) в часовом поясе эндпоинта,
 * все дни периода складываются в одни и те же 24 корзины.
 * Корзина аномальна, если ее значение больше mean + k * stddev.
 */
public class TrafficAnomalyAnalyzer {

    static final int HOURS = 24;
    static final int MAX_TIMELINE_POINTS = 20_000;
    private static final int TOP_LIMIT = 5;
    private static final Pattern INTERVAL = Pattern.compile("(\\d{1,4})([mhd])");

    private final ScoringSettings settings;

    public TrafficAnomalyAnalyzer(ScoringSettings settings) {
        this.settings = settings;
    }

    public TrafficStats analyze(TrafficSample sample, TimeRange range, ZoneId zone, boolean trafficAvailable) {
        TrafficSample traffic = sample != null ? sample : TrafficSample.empty();

        long[] buckets = new long[HOURS];
        Map<Instant, Long> perCalendarHour = new HashMap<>();
        Map<String, Long> perIp = new HashMap<>();
        Map<Integer, Long> perStatus = new TreeMap<>();
        long errors = 0;

        for (TrafficEntry entry : traffic.getEntries()) {
            Instant timestamp = entry.getTimestamp();
            if (timestamp != null) {
                buckets[timestamp.atZone(zone).getHour()]++;
                perCalendarHour.merge(timestamp.atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant(), 1L, Long::sum);
            }
            if (entry.getStatus() >= settings.getErrorStatusFrom()) {
                errors++;
            }
            if (entry.getStatus() > 0) {
                perStatus.merge(entry.getStatus(), 1L, Long::sum);
            }
            String ip = FactExtractor.sourceIp(entry);
            if (ip != null) {
                perIp.merge(ip, 1L, Long::sum);
            }
        }

        long total = traffic.size();
        double mean = mean(buckets);
        double stdDev = stdDev(buckets, mean);
        double threshold = mean + settings.getAnomalySensitivity() * stdDev;

        List<Integer> anomalous = new ArrayList<>();
        List<Long> hourly = new ArrayList<>(HOURS);
        for (int hour = 0; hour < HOURS; hour++) {
            hourly.add(buckets[hour]);
            if (stdDev > 0 && buckets[hour] > threshold) {
                anomalous.add(hour);
            }
        }

        Map<String, Long> statusCodes = new LinkedHashMap<>();
        perStatus.forEach((code, count) -> statusCodes.put(String.valueOf(code), count));

        double averagePerHour = range != null && total > 0
            ? Scores.round2((double) total / range.lengthInHours(zone))
            : 0.0;
        long peakPerHour = perCalendarHour.values().stream().mapToLong(Long::longValue).max().orElse(0L);

        return TrafficStats.builder()
            .trafficAvailable(trafficAvailable)
            .totalRequests(total)
            .sampleTruncated(traffic.isTruncated())
            .hourlyCounts(Collections.unmodifiableList(hourly))
            .errorCount(errors)
            .errorRate(Scores.percentage(errors, total))
            .meanHourlyCount(Scores.round2(mean))
            .stdDevHourlyCount(Scores.round2(stdDev))
            .anomalyThreshold(Scores.round2(threshold))
            .anomalousHours(Collections.unmodifiableList(anomalous))
            .uniqueSourceIps(perIp.size())
            .topSourceIps(topIps(perIp))
            .statusCodes(Collections.unmodifiableMap(statusCodes))
            .peakHours(peakHours(buckets))
            .averageRequestsPerHour(averagePerHour)
            .peakRequestsPerHour(peakPerHour)
            .build();
    }

    /**
     * Запросы и ошибки по интервалам фиксированной длины от начала периода.
     * Записи вне периода и без времени не учитываются.
     *
     * @throws IllegalArgumentException если интервал задан неверно или дает слишком много точек
     */
    public TrafficTimeline timeline(String endpointId, TrafficSample sample, TimeRange range,
                                    ZoneId zone, String interval) {
        Duration step = parseInterval(interval);
        Instant from = range.startInstant(zone);
        Instant to = range.endExclusive(zone);
        long stepMillis = step.toMillis();
        long spanMillis = to.toEpochMilli() - from.toEpochMilli();
        long pointCount = (spanMillis + stepMillis - 1) / stepMillis;
        if (pointCount > MAX_TIMELINE_POINTS) {
            throw new IllegalArgumentException("Интервал " + interval + " дает " + pointCount
                + " точек, допустимо не больше " + MAX_TIMELINE_POINTS);
        }

        long[] requests = new long[(int) pointCount];
        long[] errors = new long[(int) pointCount];
        TrafficSample traffic = sample != null ? sample : TrafficSample.empty();
        for (TrafficEntry entry : traffic.getEntries()) {
            if (!range.contains(entry.getTimestamp(), zone)) {
                continue;
            }
            int index = (int) ((entry.getTimestamp().toEpochMilli() - from.toEpochMilli()) / stepMillis);
            requests[index]++;
            if (entry.getStatus() >= settings.getErrorStatusFrom()) {
                errors[index]++;
            }
        }

        List<TrafficTimeline.Point> points = new ArrayList<>(requests.length);
        long totalRequests = 0;
        long totalErrors = 0;
        for (int i = 0; i < requests.length; i++) {
            points.add(TrafficTimeline.Point.builder()
                .start(from.plusMillis(i * stepMillis))
                .requests(requests[i])
                .errors(errors[i])
                .build());
            totalRequests += requests[i];
            totalErrors += errors[i];
        }

        return TrafficTimeline.builder()
            .endpointId(endpointId)
            .timeRange(range)
            .timeZone(zone.getId())
            .interval(interval.trim())
            .trafficAvailable(sample != null)
            .sampleTruncated(traffic.isTruncated())
            .totalRequests(totalRequests)
            .totalErrors(totalErrors)
            .points(Collections.unmodifiableList(points))
            .build();
    }

    /**
     * "15m", "1h", "1d": от одной минуты до одних суток
     *
     * @throws IllegalArgumentException при другом формате
     */
    public static Duration parseInterval(String interval) {
        if (interval == null) {
            throw new IllegalArgumentException("Интервал не задан");
        }
        Matcher matcher = INTERVAL.matcher(interval.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Неверный интервал: " + interval + ", ожидается например 15m, 1h, 1d");
        }
        long amount = Long.parseLong(matcher.group(1));
        Duration step = switch (matcher.group(2)) {
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofDays(amount);
        };
        if (step.isZero() || step.compareTo(Duration.ofDays(1)) > 0) {
            throw new IllegalArgumentException("Интервал должен быть от 1m до 1d: " + interval);
        }
        return step;
    }

    static double mean(long[] buckets) {
        long sum = 0;
        for (long bucket : buckets) {
            sum += bucket;
        }
        return (double) sum / buckets.length;
    }

    /**
     * Стандартное отклонение по генеральной совокупности (делим на 24)
     */
    static double stdDev(long[] buckets, double mean) {
        double sumSquares = 0.0;
        for (long bucket : buckets) {
            double diff = bucket - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / buckets.length);
    }

    private Map<String, Long> topIps(Map<String, Long> perIp) {
        Map<String, Long> top = new LinkedHashMap<>();
        perIp.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_LIMIT)
            .forEach(e -> top.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(top);
    }

    /**
     * До пяти самых нагруженных часов суток, по возрастанию часа
     */
    private List<Integer> peakHours(long[] buckets) {
        List<Integer> hours = new ArrayList<>();
        for (int hour = 0; hour < HOURS; hour++) {
            if (buckets[hour] > 0) {
                hours.add(hour);
            }
        }
        hours.sort(Comparator.<Integer>comparingLong(h -> buckets[h]).reversed()
            .thenComparing(Comparator.naturalOrder()));
        List<Integer> peak = new ArrayList<>(hours.subList(0, Math.min(TOP_LIMIT, hours.size())));
        Collections.sort(peak);
        return Collections.unmodifiableList(peak);
    }
}
