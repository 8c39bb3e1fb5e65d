package com.flagship.revenue_ledger.order;

import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Redis fast path of the duplicate check. Redis failures must never reach the caller;
 * the ledger decides.
 */
class IdempotencyServiceTest {

    private static final String CLIENT = "client-1";
    private static final String ORDER = "ord-1";
    private static final String KEY = "ledger:order:client-1:ord-1";
    private static final Duration TTL = Duration.ofDays(7);

    private LedgerStore ledgerStore;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private LedgerEntry stored;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ledgerStore = mock(LedgerStore.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        stored = LedgerEntry.builder()
                .clientId(CLIENT)
                .externalOrderId(ORDER)
                .entryHash("a".repeat(64))
                .build();
    }

    private IdempotencyService service(boolean redisEnabled) {
        return new IdempotencyService(ledgerStore, Optional.of(redisTemplate), redisEnabled, TTL);
    }

    @Nested
    @DisplayName("Redis available")
    class RedisAvailable {

        @Test
        @DisplayName("Cached hash is resolved through the ledger")
        void cacheHit() {
            when(valueOperations.get(KEY)).thenReturn(stored.getEntryHash());
            when(ledgerStore.findByHash(stored.getEntryHash())).thenReturn(Optional.of(stored));

            Optional<LedgerEntry> found = service(true).findExisting(CLIENT, ORDER);

            assertEquals(Optional.of(stored), found);
            verify(ledgerStore, never()).findByOrder(anyString(), anyString());
        }

        @Test
        @DisplayName("Miss falls through to the ledger and warms the cache")
        void cacheMiss() {
            when(ledgerStore.findByOrder(CLIENT, ORDER)).thenReturn(Optional.of(stored));

            Optional<LedgerEntry> found = service(true).findExisting(CLIENT, ORDER);

            assertTrue(found.isPresent());
            verify(valueOperations).set(KEY, stored.getEntryHash(), TTL);
        }

        @Test
        @DisplayName("Cached hash of another client's entry is ignored")
        void staleEntry() {
            LedgerEntry foreign = stored.toBuilder().clientId("client-2").build();
            when(valueOperations.get(KEY)).thenReturn(foreign.getEntryHash());
            when(ledgerStore.findByHash(foreign.getEntryHash())).thenReturn(Optional.of(foreign));
            when(ledgerStore.findByOrder(CLIENT, ORDER)).thenReturn(Optional.empty());

            assertTrue(service(true).findExisting(CLIENT, ORDER).isEmpty());
        }

        @Test
        @DisplayName("Recorded entries are remembered")
        void remember() {
            service(true).remember(stored);

            verify(valueOperations).set(KEY, stored.getEntryHash(), TTL);
        }
    }

    @Nested
    @DisplayName("Redis failing or disabled")
    class RedisUnavailable {

        @Test
        @DisplayName("Connection failure falls back to the ledger")
        void connectionFailure() {
            printTestHeader("Redis down during duplicate check");
            when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));
            doThrow(new RedisConnectionFailureException("refused"))
                    .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
            when(ledgerStore.findByOrder(CLIENT, ORDER)).thenReturn(Optional.of(stored));

            Optional<LedgerEntry> found = service(true).findExisting(CLIENT, ORDER);

            assertEquals(Optional.of(stored), found);
            assertDoesNotThrow(() -> service(true).remember(stored));
            printSuccess("Ledger answered while Redis was down");
        }

        @Test
        @DisplayName("Disabled Redis is never touched")
        void disabled() {
            when(ledgerStore.findByOrder(CLIENT, ORDER)).thenReturn(Optional.empty());

            assertTrue(service(false).findExisting(CLIENT, ORDER).isEmpty());
            service(false).remember(stored);

            verifyNoInteractions(redisTemplate);
        }

        @Test
        @DisplayName("Missing Redis template is treated as disabled")
        void noTemplate() {
            when(ledgerStore.findByOrder(CLIENT, ORDER)).thenReturn(Optional.of(stored));

            IdempotencyService withoutRedis = new IdempotencyService(ledgerStore, Optional.empty(), true, TTL);

            assertTrue(withoutRedis.findExisting(CLIENT, ORDER).isPresent());
        }
    }

    @Test
    @DisplayName("Redis key layout")
    void redisKey() {
        assertEquals(KEY, IdempotencyService.redisKey(CLIENT, ORDER));
    }
}
