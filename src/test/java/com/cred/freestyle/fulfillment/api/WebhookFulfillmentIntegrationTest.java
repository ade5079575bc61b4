package com.cred.freestyle.fulfillment.api;

import com.cred.freestyle.fulfillment.domain.model.CartItem;
import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.fulfillment.domain.model.StockItem;
import com.cred.freestyle.fulfillment.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.fulfillment.repository.*;
import com.cred.freestyle.fulfillment.service.fulfillment.ConflictCancellationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;

import static com.cred.freestyle.fulfillment.testutil.TestDataBuilder.*;
import static com.cred.freestyle.fulfillment.testutil.WebhookSigner.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end webhook tests on the embedded H2 database.
 * Kafka is mocked; Redis and CloudWatch are disabled by the test profile.
 * Every test creates its own plan so asynchronous sweeps cannot touch other tests' orders, waits for
 * its own dispatch to finish and only verifies Kafka calls for its own orders.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Webhook Fulfillment Integration Tests")
class WebhookFulfillmentIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private PlanRepository planRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private StockItemRepository stockItemRepository;

    @Autowired
    private UserSubscriptionRepository subscriptionRepository;

    @Autowired
    private CartItemRepository cartItemRepository;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    private String planId;

    @BeforeEach
    void setUp() {
        String productId = id("PROD");
        planId = id("PLAN");
        productRepository.save(product(productId, "Netflix"));
        planRepository.save(plan(planId, productId, DeliveryType.AUTOMATIC));
    }

    private String createUser() {
        String userId = id("user");
        userRepository.save(user(userId));
        return userId;
    }

    /**
     * Pending order with one item of the test plan and one pending payment.
     *
     * @return Payment ID
     */
    private String createPendingOrder(String userId, String orderId) {
        orderRepository.save(order(orderId, userId, OrderStatus.PENDING));
        orderItemRepository.save(item(id("ITEM"), orderId, planId, 1));
        Payment payment = payment(id("PAY"), orderId, PaymentStatus.PENDING);
        payment.setMethod("weepay");
        return paymentRepository.save(payment).getPaymentId();
    }

    private static String tamper(String signature) {
        char first = signature.charAt(0);
        return (first == '0' ? '1' : '0') + signature.substring(1);
    }

    private ResultActions sendWeepay(String paymentId, String transactionId, String status) throws Exception {
        byte[] body = weepayBody(paymentId, transactionId, status);
        return mockMvc.perform(post("/api/v1/webhooks/weepay")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Weepay-Signature", signWeepay(body))
                .content(body));
    }

    private Order reloadOrder(String orderId) {
        return orderRepository.findById(orderId).orElseThrow();
    }

    private Payment reloadPayment(String paymentId) {
        return paymentRepository.findById(paymentId).orElseThrow();
    }

    /**
     * Wait for the post-commit dispatch of an order, which always ends by publishing its event.
     */
    private void awaitFulfillmentEvent(String orderId, String outcome) {
        verify(kafkaProducerService, timeout(10_000)).publishFulfillmentEvent(
                argThat(event -> orderId.equals(event.getOrderId()) && outcome.equals(event.getOutcome())));
    }

    @Test
    @DisplayName("Completing one order cancels a pending competitor the remaining stock cannot cover")
    void completion_SweepsCompetingOrder() throws Exception {
        // Given
        stockItemRepository.save(stock(planId));
        String orderA = id("ORD");
        String orderB = id("ORD");
        String paymentA = createPendingOrder(createUser(), orderA);
        String paymentB = createPendingOrder(createUser(), orderB);

        // When
        sendWeepay(paymentA, id("wp"), "success")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED"));

        // Then
        assertThat(reloadOrder(orderA).getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(reloadPayment(paymentA).getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(subscriptionRepository.countByOrderId(orderA)).isEqualTo(1);

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            Order competitor = reloadOrder(orderB);
            assertThat(competitor.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(competitor.getCancellationReason()).isEqualTo(ConflictCancellationService.STOCK_CONFLICT_REASON);
            assertThat(reloadPayment(paymentB).getStatus()).isEqualTo(PaymentStatus.CANCELLED);
        });

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            OrderItem delivered = orderItemRepository.findByOrderIdOrderByCreatedAtAsc(orderA).get(0);
            assertThat(delivered.getDeliveredAt()).isNotNull();
            assertThat(stockItemRepository.countByPlanIdAndIsUsedFalse(planId)).isZero();
        });
        verify(kafkaProducerService, timeout(10_000)).publishOrderConfirmation(
                argThat(message -> ("ORD-" + orderA).equals(message.getOrderNumber())));
        awaitFulfillmentEvent(orderA, "COMPLETED");
    }

    @Test
    @DisplayName("Capture for an order whose stock is promised elsewhere: payment kept, order cancelled, cart cleared")
    void completion_StockConflict() throws Exception {
        // Given: one stock item already promised to a completed, undelivered order
        stockItemRepository.save(stock(planId));
        String holder = id("ORD");
        orderRepository.save(order(holder, createUser(), OrderStatus.COMPLETED));
        orderItemRepository.save(item(id("ITEM"), holder, planId, 1));

        String userId = createUser();
        String orderId = id("ORD");
        String paymentId = createPendingOrder(userId, orderId);
        cartItemRepository.save(CartItem.builder().userId(userId).planId(planId).build());

        // When
        sendWeepay(paymentId, id("wp"), "success")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("STOCK_CONFLICT"));

        // Then
        Payment payment = reloadPayment(paymentId);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(payment.getFailureReason()).startsWith("Stock no longer available: Netflix");
        Order order = reloadOrder(orderId);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getCancellationReason()).isEqualTo(payment.getFailureReason());
        assertThat(subscriptionRepository.countByOrderId(orderId)).isZero();
        assertThat(cartItemRepository.findByUserId(userId)).isEmpty();
        assertThat(stockItemRepository.countByPlanIdAndIsUsedFalse(planId)).isEqualTo(1);

        verify(kafkaProducerService, timeout(10_000)).publishFulfillmentEvent(
                argThat(event -> event.isReconciliationRequired() && orderId.equals(event.getOrderId())));
        verify(kafkaProducerService, never()).publishOrderConfirmation(
                argThat(message -> ("ORD-" + orderId).equals(message.getOrderNumber())));
    }

    @Test
    @DisplayName("Stock conflict across many plans stores the full shortage list")
    void completion_StockConflict_LongReasonStored() throws Exception {
        // Given: one order over 12 out-of-stock plans of a product with a long name
        String productId = id("PROD");
        productRepository.save(product(productId, "Streaming Bundle " + "x".repeat(150)));
        String userId = createUser();
        String orderId = id("ORD");
        orderRepository.save(order(orderId, userId, OrderStatus.PENDING));
        for (int i = 0; i < 12; i++) {
            String emptyPlan = id("PLAN");
            planRepository.save(plan(emptyPlan, productId, DeliveryType.AUTOMATIC));
            orderItemRepository.save(item(id("ITEM"), orderId, emptyPlan, 1));
        }
        Payment pending = payment(id("PAY"), orderId, PaymentStatus.PENDING);
        pending.setMethod("weepay");
        String paymentId = paymentRepository.save(pending).getPaymentId();

        // When
        sendWeepay(paymentId, id("wp"), "success")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("STOCK_CONFLICT"));

        // Then
        Payment payment = reloadPayment(paymentId);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(payment.getFailureReason()).hasSizeGreaterThan(2000);
        assertThat(payment.getFailureReason().split("\\(0/1\\)")).hasSize(12);
        assertThat(reloadOrder(orderId).getCancellationReason()).isEqualTo(payment.getFailureReason());
        awaitFulfillmentEvent(orderId, "STOCK_CONFLICT");
    }

    @Test
    @DisplayName("Duplicate delivery of the same webhook applies once")
    void duplicateDelivery_AppliedOnce() throws Exception {
        stockItemRepository.save(stock(planId));
        String orderId = id("ORD");
        String paymentId = createPendingOrder(createUser(), orderId);
        String transactionId = id("wp");

        sendWeepay(paymentId, transactionId, "success")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED"));
        sendWeepay(paymentId, transactionId, "success")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ALREADY_PROCESSED"));

        awaitFulfillmentEvent(orderId, "COMPLETED");
        OrderItem item = orderItemRepository.findByOrderIdOrderByCreatedAtAsc(orderId).get(0);
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(orderItemRepository.findById(item.getOrderItemId()).orElseThrow().getDeliveredAt()).isNotNull());

        // One subscription, one stock item consumed and linked to the item, one completion event
        assertThat(subscriptionRepository.countByOrderId(orderId)).isEqualTo(1);
        assertThat(stockItemRepository.countByPlanIdAndIsUsedTrue(planId)).isEqualTo(1);
        OrderItem delivered = orderItemRepository.findById(item.getOrderItemId()).orElseThrow();
        StockItem allocated = stockItemRepository.findById(delivered.getStockItemId()).orElseThrow();
        assertThat(allocated.getOrderItemId()).isEqualTo(delivered.getOrderItemId());
        assertThat(allocated.getIsUsed()).isTrue();
        verify(kafkaProducerService, times(1)).publishFulfillmentEvent(argThat(event -> orderId.equals(event.getOrderId())));
        assertThat(reloadPayment(paymentId).getProviderTransactionId()).isEqualTo(transactionId);
    }

    @Test
    @DisplayName("Unknown status is acknowledged with 200 and changes nothing")
    void unknownStatus_NoChanges() throws Exception {
        String orderId = id("ORD");
        String paymentId = createPendingOrder(createUser(), orderId);

        sendWeepay(paymentId, id("wp"), "on_hold")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("IGNORED"));

        assertThat(reloadPayment(paymentId).getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(reloadPayment(paymentId).getWebhookData()).isNull();
        assertThat(reloadOrder(orderId).getStatus()).isEqualTo(OrderStatus.PENDING);
        verify(kafkaProducerService, never()).publishFulfillmentEvent(argThat(event -> orderId.equals(event.getOrderId())));
    }

    @Test
    @DisplayName("Failed payment marks payment and order failed")
    void failedStatus_MarksFailed() throws Exception {
        String orderId = id("ORD");
        String paymentId = createPendingOrder(createUser(), orderId);

        sendWeepay(paymentId, id("wp"), "declined")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("FAILED"));

        assertThat(reloadPayment(paymentId).getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(reloadPayment(paymentId).getFailureReason()).isEqualTo("Payment failed: declined");
        assertThat(reloadOrder(orderId).getStatus()).isEqualTo(OrderStatus.FAILED);
        awaitFulfillmentEvent(orderId, "FAILED");
    }

    @Test
    @DisplayName("Bad signature returns 401 and leaves the payment untouched")
    void badSignature_Rejected() throws Exception {
        String orderId = id("ORD");
        String paymentId = createPendingOrder(createUser(), orderId);
        byte[] body = weepayBody(paymentId, "wp-1", "success");

        mockMvc.perform(post("/api/v1/webhooks/weepay")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Weepay-Signature", tamper(signWeepay(body)))
                        .content(body))
                .andExpect(status().isUnauthorized());

        assertThat(reloadPayment(paymentId).getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(reloadOrder(orderId).getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("Unknown payment returns 404")
    void unknownPayment_NotFound() throws Exception {
        sendWeepay(id("PAY"), id("wp"), "success")
                .andExpect(status().isNotFound());
    }
}
