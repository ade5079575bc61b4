package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Cart entry owned by the storefront. The fulfillment engine only deletes entries
 * for plans whose stock ran out under a paid order.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "cart_items", indexes = {
    @Index(name = "idx_cart_items_user_plan", columnList = "user_id, plan_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {

    @Id
    @Column(name = "cart_item_id", nullable = false, length = 36)
    private String cartItemId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    @Column(name = "quantity", nullable = false)
    @Builder.Default
    private Integer quantity = 1;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (cartItemId == null) {
            cartItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
