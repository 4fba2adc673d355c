package ca.nestsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for request rate limiting and webhook de-duplication.
 *
 * Both use plain string counters and markers with a TTL, so a single
 * string-serialized template is enough.
 *
 * Key layout:
 * - {@code ratelimit:{client}:{window}} request counter per fixed window
 * - {@code stripe:event:{eventId}} processed webhook marker
 *
 * @see org.springframework.data.redis.core.RedisTemplate
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    /**
     * Lettuce connection factory for a standalone Redis.
     *
     * @return configured RedisConnectionFactory
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);
        if (!redisPassword.isBlank()) {
            config.setPassword(redisPassword);
        }

        log.info("Configuring Redis connection factory: host={}, port={}", redisHost, redisPort);
        return new LettuceConnectionFactory(config);
    }

    /**
     * String template used for counters and markers.
     *
     * @param redisConnectionFactory the Redis connection factory
     * @return template with string serializers for keys and values
     */
    @Bean
    public RedisTemplate<String, String> redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();
        return template;
    }
}
