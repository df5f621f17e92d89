package uk.gegc.surveylink.features.onelink.infra.cache;

import uk.gegc.surveylink.features.onelink.application.LinkStatusCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-node status cache. Entries expire lazily on read; every {@value #SWEEP_INTERVAL} writes also
 * drop whatever else has expired, which bounds the map without scanning it on each write.
 */
public class InMemoryLinkStatusCache implements LinkStatusCache {

    static final int SWEEP_INTERVAL = 256;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final Clock clock;

    public InMemoryLinkStatusCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Boolean> getUsed(String token) {
        Entry entry = entries.get(token);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(token, entry);
            return Optional.empty();
        }
        return Optional.of(entry.used());
    }

    @Override
    public void put(String token, boolean used, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant now = clock.instant();
        if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
            evictExpired(now);
        }
        entries.put(token, new Entry(used, now.plus(ttl)));
    }

    void evictExpired(Instant now) {
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }

    public int size() {
        return entries.size();
    }

    private record Entry(boolean used, Instant expiresAt) {
    }
}
