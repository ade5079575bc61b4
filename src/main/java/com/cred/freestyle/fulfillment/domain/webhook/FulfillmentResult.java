package com.cred.freestyle.fulfillment.domain.webhook;

import java.util.List;

/**
 * Value returned by the fulfillment transaction once it has committed.
 * The post-commit phase reacts to it without re-reading any row under lock.
 *
 * @author Fulfillment Team
 */
public class FulfillmentResult {

    private final FulfillmentOutcome outcome;
    private final PaymentProvider provider;
    private final String paymentId;
    private final String orderId;
    private final String orderNumber;
    private final String userId;
    private final List<String> orderItemIds;
    private final List<String> automaticPlanIds;
    private final List<StockShortage> shortages;
    private final String reason;

    private FulfillmentResult(FulfillmentOutcome outcome, PaymentProvider provider, String paymentId,
                              String orderId, String orderNumber, String userId,
                              List<String> orderItemIds, List<String> automaticPlanIds,
                              List<StockShortage> shortages, String reason) {
        this.outcome = outcome;
        this.provider = provider;
        this.paymentId = paymentId;
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.orderItemIds = List.copyOf(orderItemIds);
        this.automaticPlanIds = List.copyOf(automaticPlanIds);
        this.shortages = List.copyOf(shortages);
        this.reason = reason;
    }

    /**
     * Payment and order completed; items to provision and plans to sweep are carried along.
     */
    public static FulfillmentResult completed(PaymentProvider provider, String paymentId, String orderId,
                                              String orderNumber, String userId,
                                              List<String> orderItemIds, List<String> automaticPlanIds) {
        return new FulfillmentResult(FulfillmentOutcome.COMPLETED, provider, paymentId, orderId, orderNumber,
                userId, orderItemIds, automaticPlanIds, List.of(), null);
    }

    public static FulfillmentResult stockConflict(PaymentProvider provider, String paymentId, String orderId,
                                                  String orderNumber, String userId,
                                                  List<StockShortage> shortages, String reason) {
        return new FulfillmentResult(FulfillmentOutcome.STOCK_CONFLICT, provider, paymentId, orderId, orderNumber,
                userId, List.of(), List.of(), shortages, reason);
    }

    /**
     * Any outcome that carries no items, plans or shortages.
     */
    public static FulfillmentResult of(FulfillmentOutcome outcome, PaymentProvider provider, String paymentId,
                                       String orderId, String orderNumber, String userId, String reason) {
        return new FulfillmentResult(outcome, provider, paymentId, orderId, orderNumber, userId,
                List.of(), List.of(), List.of(), reason);
    }

    /**
     * NO_OP status: nothing was looked up.
     */
    public static FulfillmentResult ignored(PaymentProvider provider) {
        return new FulfillmentResult(FulfillmentOutcome.IGNORED, provider, null, null, null, null,
                List.of(), List.of(), List.of(), null);
    }

    public FulfillmentOutcome getOutcome() {
        return outcome;
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public String getUserId() {
        return userId;
    }

    public List<String> getOrderItemIds() {
        return orderItemIds;
    }

    public List<String> getAutomaticPlanIds() {
        return automaticPlanIds;
    }

    public List<StockShortage> getShortages() {
        return shortages;
    }

    /**
     * Failure, cancellation or conflict reason recorded on the payment, if any.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "FulfillmentResult{outcome=" + outcome + ", provider=" + provider
                + ", paymentId=" + paymentId + ", orderId=" + orderId + "}";
    }
}
