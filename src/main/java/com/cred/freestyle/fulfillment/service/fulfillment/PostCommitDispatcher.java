package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.config.AsyncConfig;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentOutcome;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.fulfillment.infrastructure.messaging.events.FulfillmentEvent;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.service.delivery.DeliveryProvisioningService;
import com.cred.freestyle.fulfillment.service.notification.OrderNotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reacts to a committed {@link FulfillmentResult}.
 *
 * For COMPLETED: confirmation email, per-item delivery provisioning, conflict sweep.
 * For every mutating outcome: a {@link FulfillmentEvent} on Kafka.
 *
 * Every step is caught and logged on its own; nothing here can undo the commit or change
 * the response already sent to the provider.
 *
 * @author Fulfillment Team
 */
@Service
public class PostCommitDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(PostCommitDispatcher.class);

    private final OrderNotificationService notificationService;
    private final DeliveryProvisioningService deliveryService;
    private final StockConflictSweeper conflictSweeper;
    private final KafkaProducerService kafkaProducerService;
    private final FulfillmentMetricsService metricsService;

    public PostCommitDispatcher(
            OrderNotificationService notificationService,
            DeliveryProvisioningService deliveryService,
            StockConflictSweeper conflictSweeper,
            KafkaProducerService kafkaProducerService,
            FulfillmentMetricsService metricsService
    ) {
        this.notificationService = notificationService;
        this.deliveryService = deliveryService;
        this.conflictSweeper = conflictSweeper;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Run post-commit side effects on the dispatch executor.
     *
     * @param result Committed fulfillment result
     */
    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    public void dispatch(FulfillmentResult result) {
        if (!result.getOutcome().isMutating()) {
            return;
        }

        if (result.getOutcome() == FulfillmentOutcome.COMPLETED) {
            sendConfirmation(result);
            provisionItems(result);
            sweepConflicts(result);
        }
        publishEvent(result);
    }

    private void sendConfirmation(FulfillmentResult result) {
        try {
            notificationService.sendOrderConfirmation(result.getOrderId());
        } catch (Exception e) {
            metricsService.recordDispatchFailure("email");
            logger.error("Confirmation email failed for order {}", result.getOrderNumber(), e);
        }
    }

    private void provisionItems(FulfillmentResult result) {
        for (String orderItemId : result.getOrderItemIds()) {
            try {
                deliveryService.provision(result.getOrderId(), orderItemId);
            } catch (Exception e) {
                metricsService.recordDispatchFailure("delivery");
                logger.error("Delivery provisioning failed for item {} of order {}",
                        orderItemId, result.getOrderNumber(), e);
            }
        }
    }

    private void sweepConflicts(FulfillmentResult result) {
        try {
            conflictSweeper.sweep(result.getOrderId(), result.getAutomaticPlanIds());
        } catch (Exception e) {
            metricsService.recordDispatchFailure("sweep");
            logger.error("Conflict sweep failed after order {}", result.getOrderNumber(), e);
        }
    }

    private void publishEvent(FulfillmentResult result) {
        try {
            FulfillmentEvent event = new FulfillmentEvent(
                    UUID.randomUUID().toString(),
                    result.getOutcome().name(),
                    result.getProvider().key(),
                    result.getPaymentId(),
                    result.getOrderId(),
                    result.getOrderNumber(),
                    result.getUserId(),
                    result.getReason(),
                    result.getShortages().stream().map(StockShortage::describe).collect(Collectors.toList()),
                    result.getOutcome().requiresReconciliation()
            );
            kafkaProducerService.publishFulfillmentEvent(event);
        } catch (Exception e) {
            metricsService.recordDispatchFailure("event");
            logger.error("Publishing {} event failed for order {}", result.getOutcome(), result.getOrderNumber(), e);
        }
    }
}
