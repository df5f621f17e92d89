package uk.gegc.surveylink.features.onelink.infra.lock;

import uk.gegc.surveylink.features.onelink.application.DistributedLock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local lock with lease expiry, for single-instance deployments and tests.
 */
public class InMemoryDistributedLock implements DistributedLock {

    private final ConcurrentHashMap<String, Holder> holders = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDistributedLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration lease) {
        String owner = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Holder candidate = new Holder(owner, now.plus(lease));
        Holder winner = holders.compute(key, (k, current) ->
                current == null || !now.isBefore(current.expiresAt()) ? candidate : current);
        if (winner != candidate) {
            return Optional.empty();
        }
        return Optional.of(new InMemoryLease(key, owner));
    }

    @Override
    public void release(String key) {
        holders.remove(key);
    }

    public boolean isHeld(String key) {
        Holder holder = holders.get(key);
        return holder != null && clock.instant().isBefore(holder.expiresAt());
    }

    private record Holder(String owner, Instant expiresAt) {
    }

    private final class InMemoryLease implements LockLease {

        private final String key;
        private final String owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private InMemoryLease(String key, String owner) {
            this.key = key;
            this.owner = owner;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                holders.computeIfPresent(key, (k, current) -> current.owner().equals(owner) ? null : current);
            }
        }
    }
}
