package com.vtb.posture.core;

import com.vtb.posture.models.KeywordHit;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Поиск чувствительных ключевых слов в значениях заголовков и теле записей журнала.
 *
 * Запись считается совпавшей, если хотя бы одно слово найдено хотя бы в одном месте.
 * Для каждого слова запись учитывается не больше одного раза.
 */
public class SensitiveDataScanner {

    public SensitiveDataFinding scan(TrafficSample sample, SensitiveKeywordSet keywords, int sampleSize) {
        long version = keywords != null ? keywords.getVersion() : 0L;
        List<TrafficEntry> entries = sample != null ? sample.mostRecent(sampleSize) : List.of();
        if (entries.isEmpty()) {
            return SensitiveDataFinding.noData(version);
        }

        List<String> terms = keywords != null ? new ArrayList<>(keywords.getKeywords()) : List.of();
        long[] inHeaders = new long[terms.size()];
        long[] inBody = new long[terms.size()];
        long[] occurrences = new long[terms.size()];

        long matching = 0;
        long headerMatching = 0;
        long bodyMatching = 0;

        for (TrafficEntry entry : entries) {
            String headerText = headerValues(entry);
            String bodyText = entry.getBody() != null ? entry.getBody().toLowerCase(Locale.ROOT) : "";

            boolean entryHeaderHit = false;
            boolean entryBodyHit = false;
            for (int i = 0; i < terms.size(); i++) {
                String term = terms.get(i);
                boolean header = !headerText.isEmpty() && headerText.contains(term);
                boolean body = !bodyText.isEmpty() && bodyText.contains(term);
                if (header || body) {
                    occurrences[i]++;
                }
                if (header) {
                    inHeaders[i]++;
                    entryHeaderHit = true;
                }
                if (body) {
                    inBody[i]++;
                    entryBodyHit = true;
                }
            }
            if (entryHeaderHit || entryBodyHit) {
                matching++;
            }
            if (entryHeaderHit) {
                headerMatching++;
            }
            if (entryBodyHit) {
                bodyMatching++;
            }
        }

        long scanned = entries.size();
        List<KeywordHit> hits = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            if (occurrences[i] == 0) {
                continue;
            }
            hits.add(KeywordHit.builder()
                .keyword(terms.get(i))
                .occurrences(occurrences[i])
                .inHeaders(inHeaders[i])
                .inBody(inBody[i])
                .percentage(Scores.percentage(occurrences[i], scanned))
                .build());
        }
        hits.sort(Comparator.comparingLong(KeywordHit::getOccurrences).reversed()
            .thenComparing(KeywordHit::getKeyword));

        return SensitiveDataFinding.builder()
            .scannedEntries(scanned)
            .matchingEntries(matching)
            .headerMatchingEntries(headerMatching)
            .bodyMatchingEntries(bodyMatching)
            .matchPercentage(Scores.percentage(matching, scanned))
            .noData(false)
            .keywordSetVersion(version)
            .hits(Collections.unmodifiableList(hits))
            .build();
    }

    /**
     * Значения всех заголовков в нижнем регистре, через перевод строки,
     * чтобы слово не "склеилось" из соседних значений
     */
    private String headerValues(TrafficEntry entry) {
        if (entry.getHeaders() == null || entry.getHeaders().isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Map.Entry<String, String> header : entry.getHeaders().entrySet()) {
            if (header.getValue() != null) {
                text.append(header.getValue().toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        return text.toString();
    }
}
