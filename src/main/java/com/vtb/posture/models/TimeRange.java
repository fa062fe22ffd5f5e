package com.vtb.posture.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.posture.core.InvalidTimeRangeException;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Окно анализа: даты начала и конца включительно
 */
@Value
public class TimeRange {
    LocalDate start;
    LocalDate end;
    
    private TimeRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }
    
    @JsonCreator
    public static TimeRange of(@JsonProperty("start") LocalDate start,
                               @JsonProperty("end") LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidTimeRangeException("Границы периода не заданы: start=" + start + ", end=" + end);
        }
        if (start.isAfter(end)) {
            throw new InvalidTimeRangeException("Начало периода позже конца: " + start + " > " + end);
        }
        return new TimeRange(start, end);
    }
    
    /**
     * Разобрать ISO-даты (yyyy-MM-dd) или ISO date-time (берется дата)
     */
    public static TimeRange parse(String start, String end) {
        return of(parseDate(start), parseDate(end));
    }
    
    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTimeRangeException("Дата не указана");
        }
        String trimmed = value.trim();
        try {
            return trimmed.length() > 10 ? LocalDate.parse(trimmed.substring(0, 10)) : LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new InvalidTimeRangeException("Неверный формат даты: " + value);
        }
    }
    
    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }
    
    public Instant startInstant(ZoneId zone) {
        return start.atStartOfDay(zone).toInstant();
    }
    
    public Instant endExclusive(ZoneId zone) {
        return end.plusDays(1).atStartOfDay(zone).toInstant();
    }
    
    public long lengthInHours(ZoneId zone) {
        return Math.max(1, Duration.between(startInstant(zone), endExclusive(zone)).toHours());
    }
    
    public boolean contains(Instant instant, ZoneId zone) {
        if (instant == null) {
            return false;
        }
        return !instant.isBefore(startInstant(zone)) && instant.isBefore(endExclusive(zone));
    }
}
