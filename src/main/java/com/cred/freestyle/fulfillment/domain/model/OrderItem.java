package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single ordered plan within an order.
 * Links to the provisioned stock item (AUTOMATIC) or support ticket (MANUAL) once delivered.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "order_items", indexes = {
    @Index(name = "idx_order_items_order_id", columnList = "order_id"),
    @Index(name = "idx_order_items_plan_id", columnList = "plan_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {

    @Id
    @Column(name = "order_item_id", nullable = false, length = 36)
    private String orderItemId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    @Column(name = "quantity", nullable = false)
    @Builder.Default
    private Integer quantity = 1;

    /**
     * Unit price at checkout time.
     */
    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    /**
     * Copied from the plan on first delivery attempt; null until then.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_type", length = 20)
    private DeliveryType deliveryType;

    @Column(name = "stock_item_id", length = 36)
    private String stockItemId;

    @Column(name = "ticket_id", length = 36)
    private String ticketId;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (orderItemId == null) {
            orderItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }

    /**
     * Resolve the effective delivery type, falling back to the plan when not yet stamped.
     *
     * @param plan Plan this item references
     * @return Effective delivery type
     */
    public DeliveryType effectiveDeliveryType(Plan plan) {
        return deliveryType != null ? deliveryType : plan.getDeliveryType();
    }

    public boolean isDelivered() {
        return deliveredAt != null;
    }
}
