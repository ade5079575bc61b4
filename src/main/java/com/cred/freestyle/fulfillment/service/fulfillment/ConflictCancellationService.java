package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PaymentRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cancels a single pending order whose AUTOMATIC stock is gone, together with its pending payments.
 * One transaction per order; locks payments, then the order, then plans.
 *
 * @author Fulfillment Team
 */
@Service
public class ConflictCancellationService {

    private static final Logger logger = LoggerFactory.getLogger(ConflictCancellationService.class);

    public static final String STOCK_CONFLICT_REASON = "Order cancelled due to stock conflict";

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PlanRepository planRepository;
    private final StockAvailabilityChecker stockAvailabilityChecker;
    private final FulfillmentMetricsService metricsService;

    public ConflictCancellationService(
            PaymentRepository paymentRepository,
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            PlanRepository planRepository,
            StockAvailabilityChecker stockAvailabilityChecker,
            FulfillmentMetricsService metricsService
    ) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.planRepository = planRepository;
        this.stockAvailabilityChecker = stockAvailabilityChecker;
        this.metricsService = metricsService;
    }

    /**
     * Cancel the order if it is still pending and its stock can no longer be covered.
     *
     * @param orderId Competing order ID
     * @return true if the order was cancelled
     */
    @Transactional
    public boolean cancelIfShort(String orderId) {
        List<Payment> pendingPayments = paymentRepository.findByOrderIdAndStatusForUpdate(orderId, PaymentStatus.PENDING);
        Order order = orderRepository.findByIdForUpdate(orderId).orElse(null);

        if (order == null || !order.isPending()) {
            logger.debug("Order {} no longer pending, skipping conflict check", orderId);
            return false;
        }

        List<OrderItem> items = orderItemRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
        Map<String, Plan> plans = planRepository.findAllById(
                        items.stream().map(OrderItem::getPlanId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Plan::getPlanId, Function.identity()));

        List<StockShortage> shortages = stockAvailabilityChecker.findShortages(items, plans);
        if (shortages.isEmpty()) {
            return false;
        }

        Instant now = Instant.now();
        order.cancel(STOCK_CONFLICT_REASON, now);
        orderRepository.save(order);
        for (Payment payment : pendingPayments) {
            payment.cancel(STOCK_CONFLICT_REASON, now);
        }
        paymentRepository.saveAll(pendingPayments);

        metricsService.recordConflictCancellation();
        logger.info("Cancelled pending order {} and {} pending payments due to stock conflict on plans {}",
                order.getOrderNumber(), pendingPayments.size(),
                shortages.stream().map(StockShortage::getPlanId).collect(Collectors.toList()));
        return true;
    }
}
