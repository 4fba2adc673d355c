package ca.nestsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

/**
 * Main entry point for the NestSync backend.
 *
 * This Spring Boot application serves the NestSync GraphQL API for Canadian
 * diaper planning, featuring:
 * - Supabase-issued JWT authentication
 * - PIPEDA consent tracking and soft-delete retention
 * - Child profiles, diaper inventory and usage logging
 * - Notification preferences with asynchronous delivery via RabbitMQ
 * - Family collaboration with role-based caregiver permissions
 * - Stripe subscriptions with Canadian provincial tax calculation
 * - Redis-backed rate limiting and webhook de-duplication
 *
 * All timestamps are stored in UTC.
 */
@SpringBootApplication
@EnableScheduling
public class NestSyncApplication {

    public static void main(String[] args) {
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(NestSyncApplication.class, args);
    }
}
