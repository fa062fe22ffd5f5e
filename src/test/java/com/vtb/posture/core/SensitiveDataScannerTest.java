package com.vtb.posture.core;

import com.vtb.posture.models.KeywordHit;
import com.vtb.posture.models.SensitiveDataFinding;
import com.vtb.posture.models.SensitiveKeywordSet;
import com.vtb.posture.models.TrafficEntry;
import com.vtb.posture.models.TrafficSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.vtb.posture.core.EndpointFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SensitiveDataScannerTest {

    private final SensitiveDataScanner scanner = new SensitiveDataScanner();

    @Test
    void countsEachEntryOncePerKeyword() {
        List<TrafficEntry> entries = List.of(
            entryWithBody(at(0, 9), "{\"password\":\"x\",\"PASSWORD_confirm\":\"x\"}"),
            entryWithBody(at(0, 10), "{\"cvv\":\"123\"}"),
            entryWithBody(at(0, 11), "{\"amount\":1}"),
            entryWithBody(at(0, 12), "{\"amount\":2}"));

        SensitiveDataFinding finding = scanner.scan(TrafficSample.of(entries), keywords("password", "cvv"), 0);

        assertFalse(finding.isNoData());
        assertEquals(4, finding.getScannedEntries());
        assertEquals(2, finding.getMatchingEntries());
        assertEquals(50.0, finding.getMatchPercentage());
        assertEquals(0, finding.getHeaderMatchingEntries());
        assertEquals(2, finding.getBodyMatchingEntries());

        KeywordHit password = hit(finding, "password");
        assertEquals(1, password.getOccurrences());
        assertEquals(25.0, password.getPercentage());
    }

    @Test
    void searchesHeaderValuesCaseInsensitively() {
        TrafficEntry entry = TrafficEntry.builder()
            .timestamp(at(0, 9))
            .status(200)
            .headers(Map.of("X-Debug", "client_SECRET=abc"))
            .build();

        SensitiveDataFinding finding = scanner.scan(TrafficSample.of(List.of(entry)), keywords("secret"), 0);

        assertEquals(1, finding.getMatchingEntries());
        assertEquals(1, finding.getHeaderMatchingEntries());
        assertEquals(0, finding.getBodyMatchingEntries());
        assertEquals(1, hit(finding, "secret").getInHeaders());
    }

    @Test
    void findsCyrillicKeywords() {
        SensitiveDataFinding finding = scanner.scan(
            TrafficSample.of(List.of(entryWithBody(at(0, 9), "Номер Паспорта: 4510 123456"))),
            keywords("паспорт"), 0);
        assertEquals(100.0, finding.getMatchPercentage());
    }

    @Test
    void emptySampleIsNoDataNotClean() {
        SensitiveDataFinding finding = scanner.scan(TrafficSample.empty(), keywords("password"), 0);
        assertTrue(finding.isNoData());
        assertEquals(0, finding.getScannedEntries());
        assertEquals(1L, finding.getKeywordSetVersion());

        assertTrue(scanner.scan(null, keywords("password"), 0).isNoData());
    }

    @Test
    void sampleSizeLimitsScanToMostRecentEntries() {
        List<TrafficEntry> entries = new ArrayList<>();
        entries.add(entryWithBody(at(0, 9), "password=old"));
        entries.add(entryWithBody(at(5, 9), "clean"));
        entries.add(entryWithBody(at(6, 9), "clean"));

        SensitiveDataFinding recent = scanner.scan(TrafficSample.of(entries), keywords("password"), 2);
        assertEquals(2, recent.getScannedEntries());
        assertEquals(0, recent.getMatchingEntries());

        SensitiveDataFinding all = scanner.scan(TrafficSample.of(entries), keywords("password"), 0);
        assertEquals(3, all.getScannedEntries());
        assertEquals(1, all.getMatchingEntries());
    }

    @Test
    void addingKeywordNeverLowersMatchCount() {
        List<TrafficEntry> entries = List.of(
            entryWithBody(at(0, 9), "password=1"),
            entryWithBody(at(0, 10), "token=abc"),
            entryWithBody(at(0, 11), "phone=+79990000000"),
            entryWithBody(at(0, 12), "plain"));
        TrafficSample sample = TrafficSample.of(entries);

        SensitiveKeywordSet small = keywords("password");
        SensitiveKeywordSet larger = keywords("password", "phone");
        SensitiveKeywordSet largest = keywords("password", "phone", "token");

        long first = scanner.scan(sample, small, 0).getMatchingEntries();
        long second = scanner.scan(sample, larger, 0).getMatchingEntries();
        long third = scanner.scan(sample, largest, 0).getMatchingEntries();
        assertTrue(first <= second && second <= third);
        assertEquals(3, third);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 3})
    void appendingSensitiveEntriesNeverLowersMatchPercentage(int sampleSize) {
        List<TrafficEntry> entries = new ArrayList<>();
        entries.add(entryWithBody(at(0, 9), "password=1"));
        entries.add(entryWithBody(at(0, 10), "clean"));
        entries.add(entryWithBody(at(0, 11), "clean"));
        entries.add(entryWithBody(at(0, 12), "паспорт 4510"));
        entries.add(entryWithBody(at(0, 13), "clean"));
        SensitiveKeywordSet keywords = keywords("password", "паспорт");

        double previous = scanner.scan(TrafficSample.of(entries), keywords, sampleSize).getMatchPercentage();
        for (int i = 0; i < 6; i++) {
            entries.add(entryWithBody(at(1, 8 + i), i % 2 == 0 ? "{\"password\":\"" + i + "\"}" : "паспорт " + i));
            SensitiveDataFinding finding = scanner.scan(TrafficSample.of(entries), keywords, sampleSize);

            assertTrue(finding.getMatchPercentage() >= previous,
                "доля совпадений упала после добавления записи " + i + ": " + previous + " -> " + finding.getMatchPercentage());
            if (sampleSize > 0) {
                assertEquals(sampleSize, finding.getScannedEntries());
            }
            previous = finding.getMatchPercentage();
        }
        // 8 из 11 записей при полной выборке, только новые записи при ограниченной
        assertEquals(sampleSize == 0 ? Scores.percentage(8, 11) : 100.0, previous);
    }

    @Test
    void hitsSortedByOccurrencesThenKeyword() {
        List<TrafficEntry> entries = List.of(
            entryWithBody(at(0, 9), "cvv password"),
            entryWithBody(at(0, 10), "password"),
            entryWithBody(at(0, 11), "iban"));
        SensitiveDataFinding finding = scanner.scan(TrafficSample.of(entries), keywords("iban", "cvv", "password"), 0);

        assertEquals(List.of("password", "cvv", "iban"),
            finding.getHits().stream().map(KeywordHit::getKeyword).toList());
    }

    private static KeywordHit hit(SensitiveDataFinding finding, String keyword) {
        return finding.getHits().stream()
            .filter(h -> h.getKeyword().equals(keyword))
            .findFirst()
            .orElseThrow(() -> new AssertionError("Нет совпадений для " + keyword));
    }
}
