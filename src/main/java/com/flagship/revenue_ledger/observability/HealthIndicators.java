package com.flagship.revenue_ledger.observability;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the ledger's dependencies.
 */
public class HealthIndicators {

    /**
     * Reads the backlog cached by {@link OutboxMetrics}. Events that ran out of
     * relay attempts mean downstream consumers are missing ledger facts, so any of
     * them makes the outbox DOWN.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxMetrics outboxMetrics;

        public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
            this.outboxMetrics = outboxMetrics;
        }

        @Override
        public Health health() {
            OutboxMetrics.Backlog backlog = outboxMetrics.getBacklog();

            Health.Builder builder;
            if (backlog.exhausted() > 0 || backlog.size() >= BACKLOG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (backlog.size() >= BACKLOG_WARNING_THRESHOLD) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }

            return builder
                    .withDetail("backlogSize", backlog.size())
                    .withDetail("oldestEventAgeSeconds", backlog.oldestAgeSeconds())
                    .withDetail("exhaustedEvents", backlog.exhausted())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage degrades the service
     * rather than taking it down.
     */
    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Order idempotency falls back to the ledger unique key";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;
        private final boolean redisEnabled;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate,
                                    @Value("${idempotency.redis.enabled:true}") boolean redisEnabled) {
            this.redisTemplate = redisTemplate;
            this.redisEnabled = redisEnabled;
        }

        @Override
        public Health health() {
            if (!redisEnabled) {
                return Health.up().withDetail("cache", "disabled").build();
            }
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
