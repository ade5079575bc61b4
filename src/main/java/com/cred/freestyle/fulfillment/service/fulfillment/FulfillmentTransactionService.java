package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.UserSubscription;
import com.cred.freestyle.fulfillment.domain.webhook.CanonicalStatus;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentOutcome;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.domain.webhook.WebhookNotification;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.repository.CartItemRepository;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PaymentRepository;
import com.cred.freestyle.fulfillment.repository.UserSubscriptionRepository;
import com.cred.freestyle.fulfillment.service.webhook.ResolvedPayment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies a verified, resolved webhook to payment and order state in one transaction.
 *
 * Lock order: payment, then order, then AUTOMATIC plans (ascending ID). The conflict sweep uses
 * the same order. Only PENDING payments transition; anything else is acknowledged as
 * ALREADY_PROCESSED, except a capture reported for a payment that can no longer fulfil its order,
 * which is recorded as LATE_CAPTURE for reconciliation.
 *
 * Nothing here sends email, provisions stock or publishes events; the returned
 * {@link FulfillmentResult} drives those after commit.
 *
 * @author Fulfillment Team
 */
@Service
public class FulfillmentTransactionService {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentTransactionService.class);

    static final String STOCK_CONFLICT_PREFIX = "Stock no longer available: ";

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final UserSubscriptionRepository subscriptionRepository;
    private final CartItemRepository cartItemRepository;
    private final StockAvailabilityChecker stockAvailabilityChecker;
    private final FulfillmentMetricsService metricsService;

    public FulfillmentTransactionService(
            PaymentRepository paymentRepository,
            OrderRepository orderRepository,
            UserSubscriptionRepository subscriptionRepository,
            CartItemRepository cartItemRepository,
            StockAvailabilityChecker stockAvailabilityChecker,
            FulfillmentMetricsService metricsService
    ) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.cartItemRepository = cartItemRepository;
        this.stockAvailabilityChecker = stockAvailabilityChecker;
        this.metricsService = metricsService;
    }

    /**
     * Apply a canonical status to the resolved payment.
     *
     * @param resolved Resolved payment with its order graph
     * @param notification Parsed webhook
     * @param status Canonical status, never NO_OP
     * @return Committed result
     * @throws IllegalArgumentException if status is NO_OP
     */
    @Transactional
    public FulfillmentResult apply(ResolvedPayment resolved, WebhookNotification notification, CanonicalStatus status) {
        if (!status.isMutating()) {
            throw new IllegalArgumentException("NO_OP webhooks must not reach the fulfillment transaction");
        }

        String paymentId = resolved.getPayment().getPaymentId();
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new IllegalStateException("Payment disappeared: " + paymentId));
        Order order = orderRepository.findByIdForUpdate(payment.getOrderId())
                .orElseThrow(() -> new IllegalStateException("Order disappeared: " + payment.getOrderId()));

        Instant now = Instant.now();

        if (!payment.isPending()) {
            if (status == CanonicalStatus.COMPLETED
                    && (payment.getStatus() == PaymentStatus.FAILED || payment.getStatus() == PaymentStatus.CANCELLED)) {
                return lateCapture(payment, order, notification, now,
                        "Captured after payment was " + payment.getStatus());
            }
            logger.info("Payment {} already {}, ignoring {} webhook from {}",
                    payment.getPaymentId(), payment.getStatus(), status, notification.getProvider().key());
            return result(FulfillmentOutcome.ALREADY_PROCESSED, notification, payment, order, null);
        }

        switch (status) {
            case FAILED:
                return fail(payment, order, notification);
            case CANCELLED:
                return cancel(payment, order, notification, now);
            case COMPLETED:
                if (!isOpen(order)) {
                    return lateCapture(payment, order, notification, now,
                            "Captured after order was " + order.getStatus());
                }
                return complete(resolved, payment, order, notification, now);
            default:
                throw new IllegalArgumentException("Unsupported status: " + status);
        }
    }

    private FulfillmentResult complete(ResolvedPayment resolved, Payment payment, Order order,
                                       WebhookNotification notification, Instant now) {
        List<OrderItem> items = resolved.getItems();
        List<StockShortage> shortages = stockAvailabilityChecker.findShortages(items, resolved.getPlansById());

        payment.recordProviderData(notification.getProviderTransactionId(), notification.getRawPayload());
        payment.complete(now);

        if (!shortages.isEmpty()) {
            return stockConflict(payment, order, items, shortages, notification, now);
        }

        order.complete(now);
        paymentRepository.save(payment);
        orderRepository.save(order);

        int created = 0;
        for (OrderItem item : items) {
            if (subscriptionRepository.existsByOrderItemId(item.getOrderItemId())) {
                logger.warn("Subscription already exists for order item {}, skipping", item.getOrderItemId());
                continue;
            }
            Plan plan = resolved.planOf(item);
            subscriptionRepository.save(UserSubscription.startFor(order, item, plan, now));
            created++;
        }

        List<String> automaticPlanIds = items.stream()
                .map(resolved::planOf)
                .filter(Plan::isAutomatic)
                .map(Plan::getPlanId)
                .distinct()
                .collect(Collectors.toList());

        logger.info("Completed order {} via payment {} ({}), {} subscriptions created",
                order.getOrderNumber(), payment.getPaymentId(), notification.getProvider().key(), created);

        return FulfillmentResult.completed(notification.getProvider(), payment.getPaymentId(), order.getOrderId(),
                order.getOrderNumber(), order.getUserId(),
                items.stream().map(OrderItem::getOrderItemId).collect(Collectors.toList()),
                automaticPlanIds);
    }

    private FulfillmentResult stockConflict(Payment payment, Order order, List<OrderItem> items,
                                            List<StockShortage> shortages, WebhookNotification notification,
                                            Instant now) {
        String reason = STOCK_CONFLICT_PREFIX + shortages.stream()
                .map(StockShortage::describe)
                .collect(Collectors.joining(", "));

        payment.setFailureReason(reason);
        order.cancel(reason, now);
        paymentRepository.save(payment);
        orderRepository.save(order);

        Set<String> planIds = items.stream().map(OrderItem::getPlanId).collect(Collectors.toCollection(LinkedHashSet::new));
        int removed = cartItemRepository.deleteByUserIdAndPlanIdIn(order.getUserId(), planIds);

        shortages.forEach(shortage -> metricsService.recordStockConflict(shortage.getPlanId()));
        logger.warn("Stock conflict on order {}: payment {} captured but order cancelled ({}), {} cart entries removed",
                order.getOrderNumber(), payment.getPaymentId(), reason, removed);

        return FulfillmentResult.stockConflict(notification.getProvider(), payment.getPaymentId(), order.getOrderId(),
                order.getOrderNumber(), order.getUserId(), shortages, reason);
    }

    private FulfillmentResult fail(Payment payment, Order order, WebhookNotification notification) {
        String reason = "Payment failed: " + notification.getRawStatus();
        payment.recordProviderData(notification.getProviderTransactionId(), notification.getRawPayload());
        payment.fail(reason);
        paymentRepository.save(payment);

        if (isOpen(order)) {
            order.fail(reason);
            orderRepository.save(order);
        }

        logger.info("Payment {} failed ({}), order {} now {}",
                payment.getPaymentId(), notification.getRawStatus(), order.getOrderNumber(), order.getStatus());
        return result(FulfillmentOutcome.FAILED, notification, payment, order, reason);
    }

    private FulfillmentResult cancel(Payment payment, Order order, WebhookNotification notification, Instant now) {
        String reason = "Payment cancelled: " + notification.getRawStatus();
        payment.recordProviderData(notification.getProviderTransactionId(), notification.getRawPayload());
        payment.cancel(reason, now);
        paymentRepository.save(payment);

        if (isOpen(order)) {
            order.cancel(reason, now);
            orderRepository.save(order);
        }

        logger.info("Payment {} cancelled ({}), order {} now {}",
                payment.getPaymentId(), notification.getRawStatus(), order.getOrderNumber(), order.getStatus());
        return result(FulfillmentOutcome.CANCELLED, notification, payment, order, reason);
    }

    private FulfillmentResult lateCapture(Payment payment, Order order, WebhookNotification notification,
                                          Instant now, String reason) {
        payment.recordProviderData(notification.getProviderTransactionId(), notification.getRawPayload());
        payment.complete(now);
        payment.setFailureReason(reason);
        paymentRepository.save(payment);

        logger.warn("Late capture on payment {} of order {} ({}): {}, needs reconciliation",
                payment.getPaymentId(), order.getOrderNumber(), order.getStatus(), reason);
        return result(FulfillmentOutcome.LATE_CAPTURE, notification, payment, order, reason);
    }

    private static boolean isOpen(Order order) {
        return order.getStatus() == OrderStatus.PENDING || order.getStatus() == OrderStatus.PROCESSING;
    }

    private static FulfillmentResult result(FulfillmentOutcome outcome, WebhookNotification notification,
                                            Payment payment, Order order, String reason) {
        return FulfillmentResult.of(outcome, notification.getProvider(), payment.getPaymentId(), order.getOrderId(),
                order.getOrderNumber(), order.getUserId(), reason);
    }
}
