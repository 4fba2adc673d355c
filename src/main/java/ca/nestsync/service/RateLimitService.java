package ca.nestsync.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window request rate limiting backed by Redis counters.
 *
 * Each client gets one counter per window, keyed
 * {@code ratelimit:{client}:{windowIndex}}. The first increment of a window
 * sets the TTL so counters expire on their own. Defaults: 100 requests per
 * 900 seconds.
 *
 * If Redis is unreachable the request is allowed and the failure is logged;
 * rate limiting never takes the API down.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimitService {

    private static final String KEY_PREFIX = "ratelimit:";

    private final RedisTemplate<String, String> redisStringTemplate;

    @Value("${app.rate-limit.enabled:true}")
    private boolean enabled;

    @Value("${app.rate-limit.requests:100}")
    private int maxRequests;

    @Value("${app.rate-limit.window-seconds:900}")
    private long windowSeconds;

    /**
     * Count a request for the client and decide whether it may proceed.
     *
     * @param clientKey caller identity (IP address)
     * @return the decision with the remaining allowance
     */
    public Decision tryAcquire(String clientKey) {
        if (!enabled) {
            return new Decision(true, maxRequests, maxRequests);
        }

        long window = Instant.now().getEpochSecond() / windowSeconds;
        String key = KEY_PREFIX + clientKey + ":" + window;

        try {
            Long count = redisStringTemplate.opsForValue().increment(key);
            long current = count != null ? count : 1L;
            if (current == 1L) {
                redisStringTemplate.expire(key, windowSeconds, TimeUnit.SECONDS);
            }

            boolean allowed = current <= maxRequests;
            if (!allowed) {
                log.warn("Rate limit exceeded for client: {} ({} requests in window)", clientKey, current);
            }
            return new Decision(allowed, maxRequests, Math.max(0, maxRequests - current));
        } catch (RuntimeException ex) {
            log.warn("Rate limit check skipped, Redis unavailable: {}", ex.getMessage());
            return new Decision(true, maxRequests, maxRequests);
        }
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    /**
     * Outcome of a rate limit check.
     *
     * @param allowed whether the request may proceed
     * @param limit requests allowed per window
     * @param remaining requests left in the current window
     */
    public record Decision(boolean allowed, int limit, long remaining) {
    }
}
