package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Subscription granted to a user when a payment completes with sufficient stock.
 * One subscription per order item; the unique order_item_id column backs this up at the database level.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "user_subscriptions", indexes = {
    @Index(name = "idx_user_subscriptions_user_id", columnList = "user_id"),
    @Index(name = "idx_user_subscriptions_order_id", columnList = "order_id"),
    @Index(name = "idx_user_subscriptions_order_item", columnList = "order_item_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSubscription {

    @Id
    @Column(name = "subscription_id", nullable = false, length = 36)
    private String subscriptionId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "order_item_id", nullable = false, unique = true, length = 36)
    private String orderItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    @Column(name = "renewal_date")
    private Instant renewalDate;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "billing_period", length = 20)
    private String billingPeriod;

    @Column(name = "auto_renew", nullable = false)
    @Builder.Default
    private Boolean autoRenew = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (subscriptionId == null) {
            subscriptionId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }

    /**
     * Build an active subscription for an order item, starting now and lasting the plan duration.
     *
     * @param order Owning order
     * @param item Order item being fulfilled
     * @param plan Plan of the order item
     * @param now Start timestamp
     * @return New, unsaved subscription
     */
    public static UserSubscription startFor(Order order, OrderItem item, Plan plan, Instant now) {
        Instant endDate = now.plus(Duration.ofDays(plan.getDuration()));
        return UserSubscription.builder()
                .userId(order.getUserId())
                .planId(item.getPlanId())
                .orderId(order.getOrderId())
                .orderItemId(item.getOrderItemId())
                .status(SubscriptionStatus.ACTIVE)
                .startDate(now)
                .endDate(endDate)
                .renewalDate(endDate)
                .price(item.getPrice())
                .currency(item.getCurrency())
                .billingPeriod(plan.getBillingPeriod())
                .autoRenew(true)
                .build();
    }

    public enum SubscriptionStatus {
        ACTIVE,
        CANCELLED,
        EXPIRED
    }
}
