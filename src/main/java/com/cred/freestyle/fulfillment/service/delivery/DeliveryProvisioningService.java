package com.cred.freestyle.fulfillment.service.delivery;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.Product;
import com.cred.freestyle.fulfillment.domain.model.StockItem;
import com.cred.freestyle.fulfillment.domain.model.SupportTicket;
import com.cred.freestyle.fulfillment.domain.model.SupportTicketSequence;
import com.cred.freestyle.fulfillment.exception.OutOfStockException;
import com.cred.freestyle.fulfillment.exception.ResourceNotFoundException;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import com.cred.freestyle.fulfillment.repository.ProductRepository;
import com.cred.freestyle.fulfillment.repository.StockItemRepository;
import com.cred.freestyle.fulfillment.repository.SupportTicketRepository;
import com.cred.freestyle.fulfillment.repository.SupportTicketSequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Delivers a paid order item.
 *
 * AUTOMATIC items receive their quantity of stock items, oldest first, under a row lock;
 * the first allocated item is linked to the order item and the item is stamped delivered.
 * MANUAL items get a support ticket for staff to fulfil; they stay undelivered until staff close it.
 *
 * Each call is its own transaction, so one item's failure leaves its siblings untouched.
 *
 * @author Fulfillment Team
 */
@Service
public class DeliveryProvisioningService {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryProvisioningService.class);

    private static final String TICKET_CATEGORY = "ORDER_ISSUES";
    private static final String TICKET_PRIORITY = "MEDIUM";
    private static final String TICKET_TAGS = "delivery,auto-created";

    private final OrderItemRepository orderItemRepository;
    private final OrderRepository orderRepository;
    private final PlanRepository planRepository;
    private final ProductRepository productRepository;
    private final StockItemRepository stockItemRepository;
    private final SupportTicketRepository ticketRepository;
    private final SupportTicketSequenceRepository ticketSequenceRepository;
    private final FulfillmentMetricsService metricsService;

    public DeliveryProvisioningService(
            OrderItemRepository orderItemRepository,
            OrderRepository orderRepository,
            PlanRepository planRepository,
            ProductRepository productRepository,
            StockItemRepository stockItemRepository,
            SupportTicketRepository ticketRepository,
            SupportTicketSequenceRepository ticketSequenceRepository,
            FulfillmentMetricsService metricsService
    ) {
        this.orderItemRepository = orderItemRepository;
        this.orderRepository = orderRepository;
        this.planRepository = planRepository;
        this.productRepository = productRepository;
        this.stockItemRepository = stockItemRepository;
        this.ticketRepository = ticketRepository;
        this.ticketSequenceRepository = ticketSequenceRepository;
        this.metricsService = metricsService;
    }

    /**
     * Provision one order item.
     *
     * @param orderId Order ID
     * @param orderItemId Order item ID
     * @return Delivery result
     * @throws ResourceNotFoundException if the item is not part of the order
     * @throws OutOfStockException if an AUTOMATIC item cannot be covered
     */
    @Transactional
    public DeliveryResult provision(String orderId, String orderItemId) {
        OrderItem item = orderItemRepository.findByIdForUpdate(orderItemId)
                .filter(found -> found.getOrderId().equals(orderId))
                .orElseThrow(() -> new ResourceNotFoundException("OrderItem", orderItemId));
        Plan plan = planRepository.findById(item.getPlanId())
                .orElseThrow(() -> new ResourceNotFoundException("Plan", item.getPlanId()));

        DeliveryType deliveryType = item.effectiveDeliveryType(plan);
        if (item.getDeliveryType() == null) {
            item.setDeliveryType(deliveryType);
        }

        if (item.isDelivered() || (deliveryType == DeliveryType.MANUAL && item.getTicketId() != null)) {
            logger.info("Order item {} already provisioned, skipping", orderItemId);
            return DeliveryResult.alreadyDelivered(orderItemId, deliveryType);
        }

        try {
            return deliveryType == DeliveryType.AUTOMATIC
                    ? allocateStock(item, plan)
                    : openTicket(item, plan);
        } catch (RuntimeException e) {
            metricsService.recordDeliveryFailure(deliveryType.name());
            throw e;
        }
    }

    private DeliveryResult allocateStock(OrderItem item, Plan plan) {
        int quantity = item.getQuantity();
        List<StockItem> stock = stockItemRepository.findUnusedForUpdate(plan.getPlanId(), PageRequest.of(0, quantity));
        if (stock.size() < quantity) {
            throw new OutOfStockException(plan.getPlanId(), quantity, stock.size());
        }

        Instant now = Instant.now();
        stock.forEach(stockItem -> stockItem.allocateTo(item.getOrderItemId(), now));
        stockItemRepository.saveAll(stock);

        item.setStockItemId(stock.get(0).getStockItemId());
        item.setDeliveredAt(now);
        orderItemRepository.save(item);

        List<String> stockItemIds = stock.stream().map(StockItem::getStockItemId).collect(Collectors.toList());
        logger.info("Delivered {} stock items of plan {} to order item {}", quantity, plan.getPlanId(), item.getOrderItemId());
        return DeliveryResult.allocated(item.getOrderItemId(), stockItemIds);
    }

    private DeliveryResult openTicket(OrderItem item, Plan plan) {
        Order order = orderRepository.findById(item.getOrderId())
                .orElseThrow(() -> new ResourceNotFoundException("Order", item.getOrderId()));
        String productName = productRepository.findById(plan.getProductId())
                .map(Product::getName)
                .orElse(plan.getProductId());

        long number = ticketSequenceRepository.save(new SupportTicketSequence()).getValue();

        SupportTicket ticket = SupportTicket.builder()
                .ticketNumber(String.format("DELIVERY-%06d", number))
                .userId(order.getUserId())
                .title("Delivery Request - " + productName)
                .description(String.format(
                        "Manual delivery request for %s - %s.%n%nOrder: %s%nPlan: %s%nQuantity: %d",
                        productName, plan.getName(), order.getOrderNumber(), plan.getName(), item.getQuantity()))
                .category(TICKET_CATEGORY)
                .priority(TICKET_PRIORITY)
                .isAutoCreated(true)
                .tags(TICKET_TAGS)
                .build();
        ticket = ticketRepository.save(ticket);

        item.setTicketId(ticket.getTicketId());
        orderItemRepository.save(item);

        logger.info("Opened delivery ticket {} for order item {}", ticket.getTicketNumber(), item.getOrderItemId());
        return DeliveryResult.ticketOpened(item.getOrderItemId(), ticket.getTicketId());
    }
}
