package com.flagship.revenue_ledger.order;

import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Answers "was this order already recorded?" for {@code (clientId, externalOrderId)}.
 *
 * Strategy:
 * 1. Redis first: key {@code ledger:order:{clientId}:{externalOrderId}} maps to the entry hash
 * 2. Ledger store second: the unique key on the ledger is the source of truth
 * 3. A hit from the store is written back to Redis for the next lookup
 *
 * Redis is best effort throughout. When it is missing, disabled or failing, lookups
 * go straight to the store and nothing is surfaced to the caller.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:order:";

    private final LedgerStore ledgerStore;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean redisEnabled;
    private final Duration ttl;

    public IdempotencyService(LedgerStore ledgerStore,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${idempotency.redis.enabled:true}") boolean redisEnabled,
                              @Value("${idempotency.redis.ttl:7d}") Duration ttl) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
        this.redisEnabled = redisEnabled;
        this.ttl = ttl;
    }

    /**
     * Finds the entry already recorded for the order, if any. Also matches an order
     * whose identifiers were anonymized since.
     */
    public Optional<LedgerEntry> findExisting(String clientId, String externalOrderId) {
        String redisKey = redisKey(clientId, externalOrderId);

        Optional<String> cachedHash = cacheGet(redisKey);
        if (cachedHash.isPresent()) {
            Optional<LedgerEntry> cached = ledgerStore.findByHash(cachedHash.get());
            if (cached.isPresent() && cached.get().getClientId().equals(clientId)) {
                log.debug("Order found via Redis: externalOrderId={}", externalOrderId);
                return cached;
            }
            log.warn("Stale idempotency cache entry ignored: key={}", redisKey);
        }

        Optional<LedgerEntry> stored = ledgerStore.findByOrder(clientId, externalOrderId);
        stored.ifPresent(entry -> cachePut(redisKey, entry.getEntryHash()));
        return stored;
    }

    /**
     * Caches a freshly recorded order. Best effort.
     */
    public void remember(LedgerEntry entry) {
        cachePut(redisKey(entry.getClientId(), entry.getExternalOrderId()), entry.getEntryHash());
    }

    private Optional<String> cacheGet(String redisKey) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(redisKey));
        } catch (Exception e) {
            log.warn("Redis lookup failed for {}. Falling back to the ledger. Error: {}", redisKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void cachePut(String redisKey, String entryHash) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, entryHash, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {}. Error: {}", redisKey, e.getMessage());
        }
    }

    static String redisKey(String clientId, String externalOrderId) {
        return REDIS_KEY_PREFIX + clientId + ":" + externalOrderId;
    }
}
