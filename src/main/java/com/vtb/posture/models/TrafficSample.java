package com.vtb.posture.models;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Упорядоченная выборка записей журнала за период.
 * Источник может отдавать ее постранично, движок получает уже собранную последовательность.
 */
@Value
public class TrafficSample {
    private static final TrafficSample EMPTY = new TrafficSample(List.of(), false);
    
    List<TrafficEntry> entries;
    
    /** Источник отдал не все записи периода: выборка урезана до самых новых */
    boolean truncated;
    
    private TrafficSample(List<TrafficEntry> entries, boolean truncated) {
        this.entries = entries;
        this.truncated = truncated;
    }
    
    public static TrafficSample empty() {
        return EMPTY;
    }
    
    /**
     * Null-записи отбрасываются, порядок сохраняется
     */
    public static TrafficSample of(List<TrafficEntry> entries) {
        return of(entries, false);
    }
    
    public static TrafficSample of(List<TrafficEntry> entries, boolean truncated) {
        if ((entries == null || entries.isEmpty()) && !truncated) {
            return EMPTY;
        }
        if (entries == null) {
            return new TrafficSample(List.of(), true);
        }
        List<TrafficEntry> copy = new ArrayList<>(entries.size());
        for (TrafficEntry entry : entries) {
            if (entry != null) {
                copy.add(entry);
            }
        }
        return new TrafficSample(Collections.unmodifiableList(copy), truncated);
    }
    
    public int size() {
        return entries.size();
    }
    
    public boolean hasEntries() {
        return !entries.isEmpty();
    }
    
    /**
     * Последние N записей по времени (N <= 0 означает все).
     * При равных timestamp сохраняется исходный порядок.
     */
    public List<TrafficEntry> mostRecent(int limit) {
        if (limit <= 0 || entries.size() <= limit) {
            return entries;
        }
        List<TrafficEntry> sorted = new ArrayList<>(entries);
        sorted.sort((a, b) -> {
            if (a.getTimestamp() == null && b.getTimestamp() == null) {
                return 0;
            }
            if (a.getTimestamp() == null) {
                return 1;
            }
            if (b.getTimestamp() == null) {
                return -1;
            }
            return b.getTimestamp().compareTo(a.getTimestamp());
        });
        return Collections.unmodifiableList(sorted.subList(0, limit));
    }
    
    @Override
    public String toString() {
        return "TrafficSample(" + entries.size() + " entries" + (truncated ? ", truncated)" : ")");
    }
}
