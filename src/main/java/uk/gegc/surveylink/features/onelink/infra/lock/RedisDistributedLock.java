package uk.gegc.surveylink.features.onelink.infra.lock;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import uk.gegc.surveylink.features.onelink.application.DistributedLock;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SET NX PX lock. Each lease stores a random owner value so a holder whose lease already expired
 * cannot delete the lock of the next holder.
 */
@RequiredArgsConstructor
public class RedisDistributedLock implements DistributedLock {

    static final String KEY_PREFIX = "lock:";

    /**
     * KEYS[1] = lock key, ARGV[1] = owner value. Returns 1 if deleted, 0 otherwise.
     */
    static final RedisScript<Long> RELEASE_IF_OWNER = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('DEL', KEYS[1]) " +
            "end " +
            "return 0",
            Long.class);

    private final StringRedisTemplate redis;

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration lease) {
        String owner = UUID.randomUUID().toString();
        Boolean acquired = redis.opsForValue().setIfAbsent(KEY_PREFIX + key, owner, lease);
        if (!Boolean.TRUE.equals(acquired)) {
            return Optional.empty();
        }
        return Optional.of(new RedisLease(key, owner));
    }

    @Override
    public void release(String key) {
        redis.delete(KEY_PREFIX + key);
    }

    private final class RedisLease implements LockLease {

        private final String key;
        private final String owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private RedisLease(String key, String owner) {
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
                redis.execute(RELEASE_IF_OWNER, List.of(KEY_PREFIX + key), owner);
            }
        }
    }
}
