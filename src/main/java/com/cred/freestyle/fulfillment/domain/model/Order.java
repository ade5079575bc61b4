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
 * Order entity created at checkout and settled by payment webhooks.
 * Mutated only by the fulfillment transaction, the conflict sweep and refund flows.
 * Immutable once COMPLETED except for refund transitions.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_order_number", columnList = "order_number", unique = true),
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    /**
     * Human readable order number shown to the customer and echoed back by some providers.
     */
    @Column(name = "order_number", nullable = false, unique = true, length = 64)
    private String orderNumber;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "total", nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    /**
     * Set when the order reaches COMPLETED, and also when it is cancelled by a webhook or the conflict sweep.
     */
    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (orderId == null) {
            orderId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = OrderStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    /**
     * Mark order as completed after a successful, stock-validated payment.
     *
     * @param now Completion timestamp
     */
    public void complete(Instant now) {
        this.status = OrderStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Cancel the order.
     *
     * @param reason Cancellation reason
     * @param now Cancellation timestamp
     */
    public void cancel(String reason, Instant now) {
        this.status = OrderStatus.CANCELLED;
        this.cancellationReason = reason;
        this.completedAt = now;
    }

    /**
     * Mark order as failed because the provider reported a failed payment.
     *
     * @param reason Failure reason
     */
    public void fail(String reason) {
        this.status = OrderStatus.FAILED;
        this.cancellationReason = reason;
    }

    /**
     * Order lifecycle status.
     */
    public enum OrderStatus {
        /**
         * Created at checkout, awaiting payment confirmation.
         */
        PENDING,

        PROCESSING,

        /**
         * Payment confirmed and stock validated.
         */
        COMPLETED,

        /**
         * Cancelled by the provider, or because stock ran out before confirmation.
         */
        CANCELLED,

        FAILED,

        REFUNDED
    }
}
