package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Sellable plan of a product (e.g. "1 Month Premium").
 * Read-mostly reference data; the fulfillment engine only locks plan rows to serialize stock checks.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "plans", indexes = {
    @Index(name = "idx_plans_product_id", columnList = "product_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    @Id
    @Column(name = "plan_id", nullable = false, length = 36)
    private String planId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * Plan tier label (e.g. "PREMIUM", "FAMILY").
     */
    @Column(name = "plan_type", length = 50)
    private String planType;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_type", nullable = false, length = 20)
    private DeliveryType deliveryType;

    /**
     * Subscription length in days.
     */
    @Column(name = "duration_days", nullable = false)
    private Integer duration;

    @Column(name = "billing_period", length = 20)
    private String billingPeriod;

    @Column(name = "price", precision = 12, scale = 2)
    private BigDecimal price;

    public boolean isAutomatic() {
        return deliveryType == DeliveryType.AUTOMATIC;
    }
}
