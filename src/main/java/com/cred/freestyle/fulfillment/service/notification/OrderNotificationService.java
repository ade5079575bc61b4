package com.cred.freestyle.fulfillment.service.notification;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.Product;
import com.cred.freestyle.fulfillment.domain.model.User;
import com.cred.freestyle.fulfillment.exception.ResourceNotFoundException;
import com.cred.freestyle.fulfillment.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.fulfillment.infrastructure.messaging.events.OrderConfirmationEmailMessage;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import com.cred.freestyle.fulfillment.repository.ProductRepository;
import com.cred.freestyle.fulfillment.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Queues order confirmation emails for the mail worker.
 *
 * @author Fulfillment Team
 */
@Service
public class OrderNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(OrderNotificationService.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PlanRepository planRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final KafkaProducerService kafkaProducerService;

    public OrderNotificationService(
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            PlanRepository planRepository,
            ProductRepository productRepository,
            UserRepository userRepository,
            KafkaProducerService kafkaProducerService
    ) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.planRepository = planRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.kafkaProducerService = kafkaProducerService;
    }

    /**
     * Queue the confirmation email of a completed order.
     * Orders whose user has no email address are skipped.
     *
     * @param orderId Order ID
     * @return true if an email was queued
     */
    @Transactional(readOnly = true)
    public boolean sendOrderConfirmation(String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        User user = userRepository.findById(order.getUserId()).orElse(null);
        if (user == null || user.getEmail() == null || user.getEmail().isBlank()) {
            logger.warn("No email address for user {} of order {}, confirmation skipped",
                    order.getUserId(), order.getOrderNumber());
            return false;
        }

        List<OrderItem> items = orderItemRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
        Map<String, Plan> plans = planRepository.findAllById(
                        items.stream().map(OrderItem::getPlanId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Plan::getPlanId, Function.identity()));
        Map<String, Product> products = productRepository.findAllById(
                        plans.values().stream().map(Plan::getProductId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        List<OrderConfirmationEmailMessage.Line> lines = items.stream()
                .map(item -> {
                    Plan plan = plans.get(item.getPlanId());
                    String planName = plan != null ? plan.getName() : item.getPlanId();
                    Product product = plan != null ? products.get(plan.getProductId()) : null;
                    String productName = product != null ? product.getName() : planName;
                    return new OrderConfirmationEmailMessage.Line(productName, planName, item.getPrice());
                })
                .collect(Collectors.toList());

        kafkaProducerService.publishOrderConfirmation(new OrderConfirmationEmailMessage(
                user.getEmail(), user.getName(), order.getOrderNumber(), order.getTotal(), order.getCurrency(), lines));
        logger.info("Confirmation email requested for order {}", order.getOrderNumber());
        return true;
    }
}
