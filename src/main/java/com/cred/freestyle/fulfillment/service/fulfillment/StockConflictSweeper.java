package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * After an order completes, cancels other pending orders that can no longer be covered by
 * the remaining stock of the plans it consumed. Each competing order is handled in its own
 * transaction; one failure does not stop the sweep.
 *
 * @author Fulfillment Team
 */
@Service
public class StockConflictSweeper {

    private static final Logger logger = LoggerFactory.getLogger(StockConflictSweeper.class);

    private final OrderRepository orderRepository;
    private final ConflictCancellationService cancellationService;

    public StockConflictSweeper(OrderRepository orderRepository, ConflictCancellationService cancellationService) {
        this.orderRepository = orderRepository;
        this.cancellationService = cancellationService;
    }

    /**
     * Sweep pending orders competing for the given plans.
     *
     * @param completedOrderId Order that just completed
     * @param automaticPlanIds AUTOMATIC plans of that order
     * @return Number of orders cancelled
     */
    public int sweep(String completedOrderId, List<String> automaticPlanIds) {
        if (automaticPlanIds.isEmpty()) {
            return 0;
        }

        List<String> competing = orderRepository.findCompetingOrderIds(
                automaticPlanIds, completedOrderId, OrderStatus.PENDING, DeliveryType.AUTOMATIC);
        logger.debug("Conflict sweep after order {}: {} pending competitors", completedOrderId, competing.size());

        int cancelled = 0;
        for (String orderId : competing) {
            try {
                if (cancellationService.cancelIfShort(orderId)) {
                    cancelled++;
                }
            } catch (Exception e) {
                logger.error("Conflict check failed for pending order {}", orderId, e);
            }
        }

        if (cancelled > 0) {
            logger.info("Conflict sweep after order {} cancelled {} of {} pending orders",
                    completedOrderId, cancelled, competing.size());
        }
        return cancelled;
    }
}
