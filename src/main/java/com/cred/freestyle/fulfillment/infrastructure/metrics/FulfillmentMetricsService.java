package com.cred.freestyle.fulfillment.infrastructure.metrics;

import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for webhook intake and fulfillment, published to CloudWatch in production.
 *
 * Key Metrics:
 * - Webhooks received / rejected per provider
 * - Fulfillment outcomes per provider
 * - Stock conflicts per plan and conflict-sweep cancellations
 * - Post-commit side-effect failures per step
 * - Webhook handling latency
 *
 * @author Fulfillment Team
 */
@Service
public class FulfillmentMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "fulfillment.";
    private static final String WEBHOOK_PREFIX = METRIC_PREFIX + "webhook.";
    private static final String STOCK_PREFIX = METRIC_PREFIX + "stock.";
    private static final String DISPATCH_PREFIX = METRIC_PREFIX + "dispatch.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "replay_cache.";

    public FulfillmentMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record an inbound webhook before any validation.
     *
     * @param provider Provider key
     */
    public void recordWebhookReceived(String provider) {
        Counter.builder(WEBHOOK_PREFIX + "received")
                .tag("provider", provider)
                .description("Inbound payment webhooks")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected webhook.
     *
     * @param provider Provider key
     * @param reason Rejection reason (e.g. "signature", "malformed", "payment_not_found")
     */
    public void recordWebhookRejected(String provider, String reason) {
        Counter.builder(WEBHOOK_PREFIX + "rejected")
                .tag("provider", provider)
                .tag("reason", reason)
                .description("Rejected payment webhooks")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded webhook rejection for provider: {}, reason: {}", provider, reason);
    }

    /**
     * Record the outcome of a processed webhook.
     *
     * @param provider Provider key
     * @param outcome Fulfillment outcome
     */
    public void recordOutcome(String provider, FulfillmentOutcome outcome) {
        Counter.builder(METRIC_PREFIX + "outcome")
                .tag("provider", provider)
                .tag("outcome", outcome.name())
                .description("Fulfillment outcomes")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a plan that could not cover a paid order.
     *
     * @param planId Plan ID
     */
    public void recordStockConflict(String planId) {
        Counter.builder(STOCK_PREFIX + "conflict")
                .tag("plan_id", planId)
                .description("Paid orders cancelled for lack of stock")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a pending order cancelled by the conflict sweep.
     */
    public void recordConflictCancellation() {
        Counter.builder(STOCK_PREFIX + "sweep.cancelled")
                .description("Pending orders cancelled by the conflict sweep")
                .register(meterRegistry)
                .increment();
    }

    public void recordDeliveryFailure(String deliveryType) {
        Counter.builder(METRIC_PREFIX + "delivery.failure")
                .tag("delivery_type", deliveryType)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a failed post-commit step.
     *
     * @param step Step name ("email", "delivery", "sweep", "event")
     */
    public void recordDispatchFailure(String step) {
        Counter.builder(DISPATCH_PREFIX + "failure")
                .tag("step", step)
                .description("Failed post-commit side effects")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded dispatch failure for step: {}", step);
    }

    public void recordReplayCacheHit(String provider) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("provider", provider)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record end-to-end webhook handling latency (signature to commit).
     *
     * @param provider Provider key
     * @param durationMs Duration in milliseconds
     */
    public void recordWebhookLatency(String provider, long durationMs) {
        Timer.builder(WEBHOOK_PREFIX + "latency")
                .tag("provider", provider)
                .description("Webhook handling latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
