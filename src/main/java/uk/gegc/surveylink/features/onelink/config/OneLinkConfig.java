package uk.gegc.surveylink.features.onelink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import uk.gegc.surveylink.features.onelink.application.DistributedLock;
import uk.gegc.surveylink.features.onelink.application.LinkStatusCache;
import uk.gegc.surveylink.features.onelink.application.TokenCodec;
import uk.gegc.surveylink.features.onelink.infra.cache.InMemoryLinkStatusCache;
import uk.gegc.surveylink.features.onelink.infra.cache.RedisLinkStatusCache;
import uk.gegc.surveylink.features.onelink.infra.lock.InMemoryDistributedLock;
import uk.gegc.surveylink.features.onelink.infra.lock.RedisDistributedLock;
import uk.gegc.surveylink.features.onelink.infra.security.AesGcmTokenCodec;
import uk.gegc.surveylink.features.onelink.infra.security.LinkEncryptionKey;

import java.time.Clock;

/**
 * Wires the token codec and selects the status cache and lock backend.
 *
 * <p>{@code surveylink.cache.type=redis} shares cache and lock across instances;
 * {@code in-memory} (default) is only correct for a single instance.
 */
@Slf4j
@Configuration
@EnableScheduling
public class OneLinkConfig {

    @Bean
    public LinkEncryptionKey linkEncryptionKey(OneLinkProperties properties) {
        return LinkEncryptionKey.fromConfiguredSecret(properties.getEncryptionKey());
    }

    @Bean
    public TokenCodec tokenCodec(LinkEncryptionKey linkEncryptionKey, ObjectMapper objectMapper) {
        return new AesGcmTokenCodec(linkEncryptionKey, objectMapper);
    }

    @Configuration
    @ConditionalOnProperty(name = "surveylink.cache.type", havingValue = "redis")
    static class RedisBackend {

        @Bean
        public LinkStatusCache linkStatusCache(StringRedisTemplate redisTemplate) {
            log.info("Using Redis for one-time link status cache and locks");
            return new RedisLinkStatusCache(redisTemplate);
        }

        @Bean
        public DistributedLock distributedLock(StringRedisTemplate redisTemplate) {
            return new RedisDistributedLock(redisTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "surveylink.cache.type", havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryBackend {

        @Bean
        public LinkStatusCache linkStatusCache(Clock clock) {
            log.info("Using in-memory one-time link status cache and locks (single instance only)");
            return new InMemoryLinkStatusCache(clock);
        }

        @Bean
        public DistributedLock distributedLock(Clock clock) {
            return new InMemoryDistributedLock(clock);
        }
    }
}
