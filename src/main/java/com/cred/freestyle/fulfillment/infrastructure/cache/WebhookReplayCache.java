package com.cred.freestyle.fulfillment.infrastructure.cache;

import com.cred.freestyle.fulfillment.config.WebhookProperties;
import com.cred.freestyle.fulfillment.domain.webhook.CanonicalStatus;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Remembers webhooks whose effects already committed, so repeated deliveries
 * are acknowledged without opening a transaction.
 *
 * Cache Keys:
 * - webhook:processed:{provider}:{provider_tx_id}:{canonical_status} -> "1"
 *
 * Only a shortcut: any Redis error counts as a miss and the database status check decides.
 *
 * @author Fulfillment Team
 */
@Service
public class WebhookReplayCache {

    private static final Logger logger = LoggerFactory.getLogger(WebhookReplayCache.class);

    private static final String KEY_PREFIX = "webhook:processed:";

    private final StringRedisTemplate redisTemplate;
    private final WebhookProperties properties;

    public WebhookReplayCache(StringRedisTemplate redisTemplate, WebhookProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    /**
     * Check whether this delivery was already applied.
     *
     * @param provider Provider
     * @param providerTransactionId Provider transaction ID
     * @param status Canonical status
     * @return true on a cache hit
     */
    public boolean isProcessed(PaymentProvider provider, String providerTransactionId, CanonicalStatus status) {
        if (!properties.getReplayCache().isEnabled()) {
            return false;
        }
        try {
            Boolean present = redisTemplate.hasKey(key(provider, providerTransactionId, status));
            return Boolean.TRUE.equals(present);
        } catch (Exception e) {
            logger.warn("Replay cache lookup failed for {} transaction {}, falling back to database",
                    provider.key(), providerTransactionId, e);
            return false;
        }
    }

    /**
     * Remember a delivery after its transaction committed.
     *
     * @param provider Provider
     * @param providerTransactionId Provider transaction ID
     * @param status Canonical status
     */
    public void markProcessed(PaymentProvider provider, String providerTransactionId, CanonicalStatus status) {
        if (!properties.getReplayCache().isEnabled()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key(provider, providerTransactionId, status), "1",
                    properties.getReplayCache().getTtl());
            logger.debug("Cached processed webhook {} {} {}", provider.key(), providerTransactionId, status);
        } catch (Exception e) {
            logger.warn("Replay cache write failed for {} transaction {}", provider.key(), providerTransactionId, e);
        }
    }

    static String key(PaymentProvider provider, String providerTransactionId, CanonicalStatus status) {
        return KEY_PREFIX + provider.key() + ":" + providerTransactionId + ":" + status.name();
    }
}
