package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency checks behind {@code GET /health} and the static facts behind {@code GET /api/info}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private final AppSettings settings;
    private final JdbcTemplate jdbcTemplate;
    private final RedisConnectionFactory redisConnectionFactory;

    public Map<String, Object> health() {
        Map<String, Object> checks = new LinkedHashMap<>();
        checks.put("database", checkDatabase());
        checks.put("redis", checkRedis());
        boolean healthy = checks.values().stream().allMatch(HEALTHY::equals);

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", healthy ? HEALTHY : UNHEALTHY);
        health.put("service", settings.getAppName());
        health.put("version", settings.getAppVersion());
        health.put("environment", settings.getEnvironment());
        health.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        health.put("checks", checks);
        return health;
    }

    public Map<String, Object> info() {
        Map<String, Object> application = new LinkedHashMap<>();
        application.put("name", settings.getAppName());
        application.put("version", settings.getAppVersion());
        application.put("environment", settings.getEnvironment());
        application.put("region", settings.getDataRegion());
        application.put("timezone", settings.getDefaultTimezone());

        Map<String, Object> compliance = new LinkedHashMap<>();
        compliance.put("framework", "PIPEDA");
        compliance.put("pipeda_compliant", true);
        compliance.put("data_residency", "Canada");

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("graphql", "/graphql");
        endpoints.put("health", "/health");
        endpoints.put("stripe_webhook", "/webhooks/stripe");
        if (!settings.isProduction()) {
            endpoints.put("graphiql", "/graphiql");
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("application", application);
        info.put("compliance", compliance);
        info.put("endpoints", endpoints);
        info.put("currencies", List.of(settings.getCurrency()));
        return info;
    }

    String checkDatabase() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1 ? HEALTHY : UNHEALTHY;
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return UNHEALTHY;
        }
    }

    String checkRedis() {
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping()) ? HEALTHY : UNHEALTHY;
        } catch (RuntimeException e) {
            log.error("Redis health check failed: {}", e.getMessage());
            return UNHEALTHY;
        }
    }
}
