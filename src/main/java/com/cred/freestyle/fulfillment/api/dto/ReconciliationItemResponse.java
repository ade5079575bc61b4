package com.cred.freestyle.fulfillment.api.dto;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Payment;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A captured payment whose order was cancelled or failed, awaiting refund or credit.
 *
 * @author Fulfillment Team
 */
public class ReconciliationItemResponse {

    private String paymentId;
    private String orderId;
    private String orderNumber;
    private String userId;
    private String method;
    private BigDecimal amount;
    private String currency;
    private String providerTransactionId;
    private String failureReason;
    private String cancellationReason;
    private Instant capturedAt;

    public ReconciliationItemResponse() {
    }

    /**
     * Build from a payment and its order.
     *
     * @param payment Captured payment
     * @param order Closed order, may be null if it was purged
     * @return Response item
     */
    public static ReconciliationItemResponse from(Payment payment, Order order) {
        ReconciliationItemResponse response = new ReconciliationItemResponse();
        response.paymentId = payment.getPaymentId();
        response.orderId = payment.getOrderId();
        response.method = payment.getMethod();
        response.amount = payment.getAmount();
        response.currency = payment.getCurrency();
        response.providerTransactionId = payment.getProviderTransactionId();
        response.failureReason = payment.getFailureReason();
        response.capturedAt = payment.getCompletedAt();
        if (order != null) {
            response.orderNumber = order.getOrderNumber();
            response.userId = order.getUserId();
            response.cancellationReason = order.getCancellationReason();
        }
        return response;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(String paymentId) {
        this.paymentId = paymentId;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getProviderTransactionId() {
        return providerTransactionId;
    }

    public void setProviderTransactionId(String providerTransactionId) {
        this.providerTransactionId = providerTransactionId;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void setCancellationReason(String cancellationReason) {
        this.cancellationReason = cancellationReason;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public void setCapturedAt(Instant capturedAt) {
        this.capturedAt = capturedAt;
    }
}
