package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.Product;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import com.cred.freestyle.fulfillment.repository.ProductRepository;
import com.cred.freestyle.fulfillment.repository.StockItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Re-checks AUTOMATIC stock for an order inside the caller's transaction.
 *
 * Available stock of a plan is its unused stock items minus the quantity already sold to
 * COMPLETED orders that delivery provisioning has not allocated yet. Plan rows are locked
 * in ascending ID order first, so two transactions checking the same plan run one after the other
 * and the second sees the first one's committed sale.
 *
 * @author Fulfillment Team
 */
@Component
public class StockAvailabilityChecker {

    private static final Logger logger = LoggerFactory.getLogger(StockAvailabilityChecker.class);

    private final PlanRepository planRepository;
    private final ProductRepository productRepository;
    private final StockItemRepository stockItemRepository;
    private final OrderItemRepository orderItemRepository;

    public StockAvailabilityChecker(
            PlanRepository planRepository,
            ProductRepository productRepository,
            StockItemRepository stockItemRepository,
            OrderItemRepository orderItemRepository
    ) {
        this.planRepository = planRepository;
        this.productRepository = productRepository;
        this.stockItemRepository = stockItemRepository;
        this.orderItemRepository = orderItemRepository;
    }

    /**
     * Lock the order's AUTOMATIC plans and list the ones whose available stock is short.
     *
     * @param items Items of the order
     * @param plansById Plans of those items
     * @return Shortages, empty if every AUTOMATIC item can be covered
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<StockShortage> findShortages(List<OrderItem> items, Map<String, Plan> plansById) {
        Map<String, Long> requestedByPlan = new TreeMap<>();
        for (OrderItem item : items) {
            Plan plan = plansById.get(item.getPlanId());
            if (plan != null && plan.isAutomatic()) {
                requestedByPlan.merge(item.getPlanId(), item.getQuantity().longValue(), Long::sum);
            }
        }
        if (requestedByPlan.isEmpty()) {
            return List.of();
        }

        List<Plan> lockedPlans = planRepository.findAllByIdForUpdate(requestedByPlan.keySet());

        List<StockShortage> shortages = new ArrayList<>();
        for (Plan plan : lockedPlans) {
            long requested = requestedByPlan.get(plan.getPlanId());
            long available = availableStock(plan.getPlanId());
            if (available < requested) {
                String productName = productRepository.findById(plan.getProductId())
                        .map(Product::getName)
                        .orElse(plan.getProductId());
                shortages.add(new StockShortage(plan.getPlanId(), productName, plan.getName(), requested, available));
                logger.warn("Stock short for plan {}: requested {}, available {}", plan.getPlanId(), requested, available);
            }
        }
        return shortages;
    }

    /**
     * Stock of a plan not yet promised to any completed order.
     *
     * @param planId Plan ID
     * @return Available quantity, never negative
     */
    public long availableStock(String planId) {
        long unused = stockItemRepository.countByPlanIdAndIsUsedFalse(planId);
        Long promised = orderItemRepository.sumUndeliveredQuantity(planId, OrderStatus.COMPLETED, DeliveryType.AUTOMATIC);
        return Math.max(0, unused - (promised == null ? 0 : promised));
    }
}
