package uk.gegc.surveylink.features.onelink.application;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived mutual exclusion keyed by string. Acquisition never waits.
 */
public interface DistributedLock {

    /**
     * Tries to take the lock for {@code lease}. The lease is not renewed; once it elapses
     * another caller may acquire the same key.
     *
     * @return a lease handle when acquired, empty if the key is currently held
     */
    Optional<LockLease> tryAcquire(String key, Duration lease);

    /**
     * Releases the key regardless of owner. No-op when the key is not held.
     */
    void release(String key);

    /**
     * Handle of an acquired lock. {@link #release()} only frees the lock while this lease still owns it,
     * and may be called any number of times.
     */
    interface LockLease extends AutoCloseable {

        String key();

        void release();

        @Override
        default void close() {
            release();
        }
    }
}
