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
 * A payment attempt against an order. An order may have several attempts.
 * Status only moves forward from PENDING; refund branches from COMPLETED are handled elsewhere.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payments_order_id", columnList = "order_id"),
    @Index(name = "idx_payments_provider_tx", columnList = "provider_transaction_id"),
    @Index(name = "idx_payments_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @Column(name = "payment_id", nullable = false, length = 36)
    private String paymentId;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    /**
     * Payment method / provider key (e.g. "cryptomus", "weepay").
     */
    @Column(name = "method", nullable = false, length = 50)
    private String method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    @Column(name = "provider_transaction_id", length = 255)
    private String providerTransactionId;

    /**
     * Raw provider payload of the last applied webhook, kept for audit.
     */
    @Column(name = "webhook_data", columnDefinition = "TEXT")
    private String webhookData;

    /**
     * Unbounded: a stock conflict lists every short plan of the order.
     */
    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = PaymentStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }

    /**
     * Record provider evidence of the webhook being applied.
     *
     * @param transactionId Provider transaction ID
     * @param rawPayload Raw webhook body
     */
    public void recordProviderData(String transactionId, String rawPayload) {
        if (transactionId != null) {
            this.providerTransactionId = transactionId;
        }
        this.webhookData = rawPayload;
    }

    /**
     * Mark payment as captured by the provider.
     *
     * @param now Completion timestamp
     */
    public void complete(Instant now) {
        this.status = PaymentStatus.COMPLETED;
        this.completedAt = now;
    }

    public void fail(String reason) {
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
    }

    public void cancel(String reason, Instant now) {
        this.status = PaymentStatus.CANCELLED;
        this.failureReason = reason;
        this.completedAt = now;
    }

    /**
     * Canonical payment status.
     */
    public enum PaymentStatus {
        PENDING,
        COMPLETED,
        FAILED,
        CANCELLED,
        REFUNDED,
        PARTIALLY_REFUNDED
    }
}
