package com.vtb.posture.share;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Хранилище снимков отчетов для share-ссылок в памяти процесса.
 * Снимок живет ttl, просроченные удаляются при обращении и при сохранении.
 */
@Slf4j
public class ShareSnapshotStore {

    private final ConcurrentMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public ShareSnapshotStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public Instant put(String token, String json) {
        evictExpired();
        Instant expiresAt = clock.instant().plus(ttl);
        snapshots.put(token, new Snapshot(json, expiresAt));
        return expiresAt;
    }

    public Optional<String> get(String token) {
        if (token == null) {
            return Optional.empty();
        }
        Snapshot snapshot = snapshots.get(token);
        if (snapshot == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(snapshot.expiresAt)) {
            snapshots.remove(token, snapshot);
            log.debug("Share-снимок {} просрочен", token);
            return Optional.empty();
        }
        return Optional.of(snapshot.json);
    }

    public boolean contains(String token) {
        return token != null && snapshots.containsKey(token);
    }

    public int size() {
        return snapshots.size();
    }

    void evictExpired() {
        Instant now = clock.instant();
        snapshots.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt));
    }

    private static final class Snapshot {
        private final String json;
        private final Instant expiresAt;

        Snapshot(String json, Instant expiresAt) {
            this.json = json;
            this.expiresAt = expiresAt;
        }
    }
}
