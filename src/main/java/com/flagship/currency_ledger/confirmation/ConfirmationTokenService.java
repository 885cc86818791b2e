package com.flagship.currency_ledger.confirmation;

import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * Two-step confirmation for destructive operations.
 *
 * {@link #requestDeletion} issues a short-lived single-use token bound to one target;
 * the destructive call must present it and {@link #consume} burns it in the same
 * transaction as the deletion.
 *
 * Postgres is the source of truth. Redis holds a copy with the same TTL so that
 * obviously wrong tokens are rejected without touching the database; Redis errors
 * are logged and the database answers instead.
 */
@Service
@Slf4j
public class ConfirmationTokenService {

    static final String REDIS_KEY_PREFIX = "deletion-confirmation:";
    private static final int TOKEN_BYTES = 24;

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerProperties properties;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final SecureRandom random = new SecureRandom();

    public ConfirmationTokenService(JdbcTemplate jdbcTemplate,
                                    Optional<StringRedisTemplate> redisTemplate,
                                    LedgerProperties properties,
                                    Clock clock,
                                    LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Transactional
    public DeletionRequest requestDeletion(String targetType, UUID targetId) {
        Duration ttl = properties.getConfirmation().getTtl();
        String token = newToken();
        Instant expiresAt = clock.instant().plus(ttl);

        jdbcTemplate.update(
            "INSERT INTO deletion_confirmations (token, target_type, target_id, expires_at) VALUES (?, ?, ?, ?)",
            token,
            targetType,
            targetId,
            Timestamp.from(expiresAt)
        );
        cache(token, targetType, targetId, ttl);

        metrics.recordDeletionToken(targetType, "issued");
        log.info("Issued deletion confirmation: targetType={}, targetId={}, expiresAt={}",
                targetType, targetId, expiresAt);
        return new DeletionRequest(token, targetType, targetId, expiresAt);
    }

    /**
     * Marks the token used. Runs in the caller's transaction, so a failed deletion
     * leaves the token valid.
     *
     * @throws ValidationException when the token is unknown, expired, already used
     *         or was issued for a different target
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void consume(String targetType, UUID targetId, String token) {
        if (token == null || token.isBlank()) {
            metrics.recordDeletionToken(targetType, "missing");
            throw new ValidationException("A confirmation token is required; request one first");
        }

        String cachedTarget = lookupCached(token);
        if (cachedTarget != null && !cachedTarget.equals(cacheValue(targetType, targetId))) {
            metrics.recordDeletionToken(targetType, "rejected");
            throw new ValidationException("Confirmation token was issued for a different target");
        }

        int updated = jdbcTemplate.update(
            "UPDATE deletion_confirmations SET consumed_at = ? " +
            "WHERE token = ? AND target_type = ? AND target_id = ? AND consumed_at IS NULL AND expires_at > ?",
            Timestamp.from(clock.instant()),
            token,
            targetType,
            targetId,
            Timestamp.from(clock.instant())
        );
        if (updated != 1) {
            metrics.recordDeletionToken(targetType, "rejected");
            throw new ValidationException("Confirmation token is invalid, expired or already used");
        }

        evict(token);
        metrics.recordDeletionToken(targetType, "consumed");
        log.debug("Consumed deletion confirmation: targetType={}, targetId={}", targetType, targetId);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String cacheValue(String targetType, UUID targetId) {
        return targetType + ":" + targetId;
    }

    private void cache(String token, String targetType, UUID targetId, Duration ttl) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + token, cacheValue(targetType, targetId), ttl);
            } catch (DataAccessException e) {
                log.warn("Failed to cache confirmation token in Redis, database remains authoritative: {}",
                        e.getMessage());
            }
        });
    }

    private String lookupCached(String token) {
        if (redisTemplate.isEmpty()) {
            return null;
        }
        try {
            return redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + token);
        } catch (DataAccessException e) {
            log.warn("Redis lookup failed for confirmation token, falling back to database: {}", e.getMessage());
            return null;
        }
    }

    private void evict(String token) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.delete(REDIS_KEY_PREFIX + token);
            } catch (DataAccessException e) {
                log.debug("Failed to evict confirmation token from Redis: {}", e.getMessage());
            }
        });
    }
}
