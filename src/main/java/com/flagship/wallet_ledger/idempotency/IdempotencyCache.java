package com.flagship.wallet_ledger.idempotency;

import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.transfer.TransferType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for idempotency lookups.
 *
 * Holds only keys whose unit of work already committed, and every failure here degrades
 * to a miss. The database record stays the source of truth.
 */
@Component
@ConditionalOnProperty(name = "ledger.idempotency.cache-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class IdempotencyCache {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyCache(StringRedisTemplate redisTemplate, LedgerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotency().getCacheTtl();
    }

    public Optional<UUID> get(TransferType scope, String idempotencyKey, UUID accountId) {
        try {
            String transferId = redisTemplate.opsForValue().get(redisKey(scope, idempotencyKey, accountId));
            if (transferId != null) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return Optional.of(UUID.fromString(transferId));
            }
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    public void put(TransferType scope, String idempotencyKey, UUID accountId, UUID transferId) {
        try {
            redisTemplate.opsForValue().set(redisKey(scope, idempotencyKey, accountId), transferId.toString(), ttl);
            log.debug("Cached idempotency key in Redis: {} -> {}", idempotencyKey, transferId);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static String redisKey(TransferType scope, String idempotencyKey, UUID accountId) {
        return REDIS_KEY_PREFIX + scope + ":" + accountId + ":" + idempotencyKey;
    }
}
