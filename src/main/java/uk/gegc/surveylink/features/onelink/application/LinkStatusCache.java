package uk.gegc.surveylink.features.onelink.application;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory, TTL-bounded projection of a link's used flag. Implementations may throw on
 * infrastructure errors; callers treat every failure as a cache miss.
 */
public interface LinkStatusCache {

    /**
     * @return the cached used flag, or empty on a miss
     */
    Optional<Boolean> getUsed(String token);

    void put(String token, boolean used, Duration ttl);
}
