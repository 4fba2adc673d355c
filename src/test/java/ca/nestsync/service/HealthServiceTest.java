package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthService Unit Tests")
class HealthServiceTest {

    @Mock
    private AppSettings settings;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private RedisConnectionFactory redisConnectionFactory;

    @Mock
    private RedisConnection redisConnection;

    @InjectMocks
    private HealthService healthService;

    @Test
    @DisplayName("All dependencies up reports healthy")
    void testHealthy() {
        // Arrange
        when(settings.getAppName()).thenReturn("NestSync");
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
        when(redisConnectionFactory.getConnection()).thenReturn(redisConnection);
        when(redisConnection.ping()).thenReturn("PONG");

        // Act
        Map<String, Object> health = healthService.health();

        // Assert
        assertEquals(HealthService.HEALTHY, health.get("status"));
        assertEquals("NestSync", health.get("service"));
        assertEquals(Map.of("database", "healthy", "redis", "healthy"), health.get("checks"));
        verify(redisConnection).close();
    }

    @Test
    @DisplayName("A failing database marks the service unhealthy")
    void testDatabaseDown() {
        // Arrange
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(redisConnectionFactory.getConnection()).thenReturn(redisConnection);
        when(redisConnection.ping()).thenReturn("PONG");

        // Act
        Map<String, Object> health = healthService.health();

        // Assert
        assertEquals(HealthService.UNHEALTHY, health.get("status"));
        assertEquals(Map.of("database", "unhealthy", "redis", "healthy"), health.get("checks"));
    }

    @Test
    @DisplayName("An unreachable Redis marks the service unhealthy")
    void testRedisDown() {
        // Arrange
        when(redisConnectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("down"));

        // Act & Assert
        assertEquals(HealthService.UNHEALTHY, healthService.checkRedis());
    }

    @Test
    @DisplayName("GraphiQL is only advertised outside production")
    void testInfoEndpoints() {
        // Arrange
        when(settings.isProduction()).thenReturn(false, true);
        when(settings.getCurrency()).thenReturn("CAD");

        // Act
        Map<String, Object> development = healthService.info();
        Map<String, Object> production = healthService.info();

        // Assert
        assertTrue(((Map<?, ?>) development.get("endpoints")).containsKey("graphiql"));
        assertFalse(((Map<?, ?>) production.get("endpoints")).containsKey("graphiql"));
        assertEquals("Canada", ((Map<?, ?>) production.get("compliance")).get("data_residency"));
        assertEquals(List.of("CAD"), production.get("currencies"));
    }
}
