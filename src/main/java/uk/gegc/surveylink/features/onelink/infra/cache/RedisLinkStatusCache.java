package uk.gegc.surveylink.features.onelink.infra.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import uk.gegc.surveylink.features.onelink.application.LinkStatusCache;

import java.time.Duration;
import java.util.Optional;

/**
 * Keeps link status under {@code onelink:status:<token>} as "used" / "unused" with a TTL.
 */
@RequiredArgsConstructor
public class RedisLinkStatusCache implements LinkStatusCache {

    static final String KEY_PREFIX = "onelink:status:";
    static final String USED = "used";
    static final String UNUSED = "unused";

    private final StringRedisTemplate redis;

    @Override
    public Optional<Boolean> getUsed(String token) {
        String status = redis.opsForValue().get(KEY_PREFIX + token);
        if (status == null) {
            return Optional.empty();
        }
        return Optional.of(USED.equals(status));
    }

    @Override
    public void put(String token, boolean used, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        redis.opsForValue().set(KEY_PREFIX + token, used ? USED : UNUSED, ttl);
    }
}
