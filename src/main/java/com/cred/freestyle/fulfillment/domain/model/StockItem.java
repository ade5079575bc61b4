package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * One-time-use secret content sold through an AUTOMATIC plan.
 * A stock item is allocated to at most one order item, ever, and is never recycled.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "stock_items", indexes = {
    @Index(name = "idx_stock_items_plan_used", columnList = "plan_id, is_used"),
    @Index(name = "idx_stock_items_order_item", columnList = "order_item_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockItem {

    @Id
    @Column(name = "stock_item_id", nullable = false, length = 36)
    private String stockItemId;

    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    /**
     * Secret payload (account credentials, license key, ...). Never logged.
     */
    @ToString.Exclude
    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "is_used", nullable = false)
    @Builder.Default
    private Boolean isUsed = false;

    @Column(name = "used_at")
    private Instant usedAt;

    /**
     * Order item this stock item was allocated to.
     */
    @Column(name = "order_item_id", length = 36)
    private String orderItemId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (stockItemId == null) {
            stockItemId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (isUsed == null) {
            isUsed = false;
        }
    }

    /**
     * Allocate this stock item to an order item.
     *
     * @param orderItemId Receiving order item
     * @param now Allocation timestamp
     * @throws IllegalStateException if the item was already consumed
     */
    public void allocateTo(String orderItemId, Instant now) {
        if (Boolean.TRUE.equals(isUsed)) {
            throw new IllegalStateException("Stock item already used: " + stockItemId);
        }
        this.isUsed = true;
        this.usedAt = now;
        this.orderItemId = orderItemId;
    }
}
