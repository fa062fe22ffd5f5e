package com.vtb.posture.keywords;

import com.vtb.posture.models.SensitiveKeywordSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class SensitiveKeywordRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsBundledDictionaryFromClasspath() {
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry("classpath:sensitive-keywords.txt");
        SensitiveKeywordSet set = registry.initialize();

        assertEquals(1L, set.getVersion());
        assertTrue(set.getKeywords().contains("password"));
        assertTrue(set.getKeywords().contains("паспорт"));
        assertSame(set, registry.current());
    }

    @Test
    void initializeFailsOnMissingOrEmptySource() {
        assertThrows(KeywordSetLoadException.class,
            () -> new SensitiveKeywordRegistry("classpath:no-such-file.txt").initialize());
        assertThrows(KeywordSetLoadException.class,
            () -> new SensitiveKeywordRegistry(tempDir.resolve("missing.txt").toString()).initialize());
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        Path file = tempDir.resolve("empty.txt");
        Files.writeString(file, "# nothing here\n", StandardCharsets.UTF_8);
        KeywordSetLoadException error = assertThrows(KeywordSetLoadException.class,
            () -> new SensitiveKeywordRegistry(file.toString()).initialize());
        assertEquals(file.toString(), error.getSource());
    }

    @Test
    void currentBeforeInitializeIsAnError() {
        assertThrows(IllegalStateException.class, () -> new SensitiveKeywordRegistry("x").current());
    }

    @Test
    void successfulReloadSwapsSetAndBumpsVersion() throws Exception {
        Path file = tempDir.resolve("keywords.txt");
        Files.writeString(file, "password\n", StandardCharsets.UTF_8);
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry(file.toString());
        registry.initialize();

        Files.writeString(file, "password, cvv\n", StandardCharsets.UTF_8);
        ReloadOutcome outcome = registry.reload();

        assertTrue(outcome.isSuccess());
        assertEquals(2L, outcome.getActiveVersion());
        assertEquals(2, outcome.getKeywordCount());
        assertNull(outcome.getError());
        assertEquals(List.of("cvv", "password"), new ArrayList<>(registry.current().getKeywords()));
    }

    @Test
    void failedReloadKeepsPreviousSet() throws Exception {
        Path file = tempDir.resolve("keywords.txt");
        Files.writeString(file, "password\nsecret\n", StandardCharsets.UTF_8);
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry(file.toString());
        SensitiveKeywordSet before = registry.initialize();

        Files.delete(file);
        ReloadOutcome outcome = registry.reload();

        assertFalse(outcome.isSuccess());
        assertEquals(1L, outcome.getActiveVersion());
        assertEquals(2, outcome.getKeywordCount());
        assertNotNull(outcome.getError());
        assertSame(before, registry.current());
    }

    @Test
    void readersNeverSeePartialSets() throws Exception {
        Path file = tempDir.resolve("keywords.txt");
        Files.writeString(file, "a\nb\n", StandardCharsets.UTF_8);
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry(file.toString());
        registry.initialize();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                readers.add(pool.submit(() -> {
                    for (int n = 0; n < 500; n++) {
                        SensitiveKeywordSet snapshot = registry.current();
                        // Версия 1: {a, b}; все последующие: {a, b, c}
                        int expected = snapshot.getVersion() == 1L ? 2 : 3;
                        if (snapshot.size() != expected) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            Files.writeString(file, "a\nb\nc\n", StandardCharsets.UTF_8);
            for (int i = 0; i < 20; i++) {
                assertTrue(registry.reload().isSuccess());
            }
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(21L, registry.current().getVersion());
    }

    @Test
    void concurrentReloadsGetDistinctVersions() throws Exception {
        Path file = tempDir.resolve("keywords.txt");
        Files.writeString(file, "password\n", StandardCharsets.UTF_8);
        SensitiveKeywordRegistry registry = new SensitiveKeywordRegistry(file.toString());
        registry.initialize();

        int threads = 8;
        int reloadsPerThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> versions = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < reloadsPerThread; n++) {
                        ReloadOutcome outcome = registry.reload();
                        assertTrue(outcome.isSuccess());
                        assertTrue(versions.add(outcome.getActiveVersion()),
                            "версия " + outcome.getActiveVersion() + " выдана дважды");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get();
            }
        } finally {
            pool.shutdownNow();
        }
        long reloads = (long) threads * reloadsPerThread;
        assertEquals(reloads, versions.size());
        assertEquals(1L + reloads, registry.current().getVersion());
    }
}
