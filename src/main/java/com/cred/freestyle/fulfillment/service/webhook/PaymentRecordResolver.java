package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.Product;
import com.cred.freestyle.fulfillment.domain.webhook.WebhookNotification;
import com.cred.freestyle.fulfillment.exception.PaymentNotFoundException;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PaymentRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import com.cred.freestyle.fulfillment.repository.ProductRepository;
import com.cred.freestyle.fulfillment.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Locates the payment a webhook refers to and loads its order graph.
 *
 * Strategies are tried in order, first match wins:
 * 1. internal payment ID
 * 2. provider transaction ID
 * 3. order number (latest payment attempt of that order)
 *
 * @author Fulfillment Team
 */
@Service
public class PaymentRecordResolver {

    private static final Logger logger = LoggerFactory.getLogger(PaymentRecordResolver.class);

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PlanRepository planRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final List<PaymentResolutionStrategy> strategies;

    public PaymentRecordResolver(
            PaymentRepository paymentRepository,
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            PlanRepository planRepository,
            ProductRepository productRepository,
            UserRepository userRepository
    ) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.planRepository = planRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.strategies = List.of(
                new PaymentResolutionStrategy("payment_id",
                        n -> present(n.getPaymentId()).flatMap(paymentRepository::findById)),
                new PaymentResolutionStrategy("provider_transaction_id",
                        n -> present(n.getProviderTransactionId()).flatMap(paymentRepository::findFirstByProviderTransactionId)),
                new PaymentResolutionStrategy("order_number",
                        n -> present(n.getOrderNumber())
                                .flatMap(number -> paymentRepository.findByOrderNumberLatestFirst(number).stream().findFirst()))
        );
    }

    /**
     * Resolve the payment and its order graph.
     *
     * @param notification Parsed webhook
     * @return Resolved payment with order, items, plans, products and user
     * @throws PaymentNotFoundException if no strategy matches
     * @throws IllegalStateException if the payment's order is missing
     */
    public ResolvedPayment resolve(WebhookNotification notification) {
        for (PaymentResolutionStrategy strategy : strategies) {
            Optional<Payment> match = strategy.resolve(notification);
            if (match.isPresent()) {
                logger.debug("Resolved payment {} by {} for {}", match.get().getPaymentId(), strategy.getName(), notification);
                return load(match.get(), strategy.getName());
            }
        }

        List<String> tried = strategies.stream().map(PaymentResolutionStrategy::getName).collect(Collectors.toList());
        logger.warn("No payment found for {} (tried {})", notification, tried);
        throw new PaymentNotFoundException(tried);
    }

    /**
     * Strategies in the order they are tried.
     */
    public List<PaymentResolutionStrategy> getStrategies() {
        return strategies;
    }

    private ResolvedPayment load(Payment payment, String resolvedBy) {
        Order order = orderRepository.findById(payment.getOrderId())
                .orElseThrow(() -> new IllegalStateException(
                        "Order " + payment.getOrderId() + " of payment " + payment.getPaymentId() + " not found"));

        List<OrderItem> items = orderItemRepository.findByOrderIdOrderByCreatedAtAsc(order.getOrderId());

        Set<String> planIds = items.stream().map(OrderItem::getPlanId).collect(Collectors.toSet());
        Map<String, Plan> plans = planRepository.findAllById(planIds).stream()
                .collect(Collectors.toMap(Plan::getPlanId, Function.identity()));

        Set<String> productIds = plans.values().stream().map(Plan::getProductId).collect(Collectors.toSet());
        Map<String, Product> products = productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        return new ResolvedPayment(payment, order, items, plans, products,
                userRepository.findById(order.getUserId()).orElse(null), resolvedBy);
    }

    private static Optional<String> present(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }
}
