package com.cred.freestyle.fulfillment.infrastructure.messaging.events;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Event published after a webhook changed payment or order state.
 * Consumed by refund and support tooling; events flagged {@code reconciliationRequired}
 * describe a captured payment whose order was not fulfilled.
 *
 * Keyed by order ID so all events of an order land on one partition.
 *
 * @author Fulfillment Team
 */
public class FulfillmentEvent {

    private String eventId;
    private String outcome;
    private String provider;
    private String paymentId;
    private String orderId;
    private String orderNumber;
    private String userId;
    private String reason;
    private List<String> shortages = new ArrayList<>();
    private boolean reconciliationRequired;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public FulfillmentEvent() {
    }

    public FulfillmentEvent(String eventId, String outcome, String provider, String paymentId, String orderId,
                            String orderNumber, String userId, String reason, List<String> shortages,
                            boolean reconciliationRequired) {
        this.eventId = eventId;
        this.outcome = outcome;
        this.provider = provider;
        this.paymentId = paymentId;
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.reason = reason;
        this.shortages = new ArrayList<>(shortages);
        this.reconciliationRequired = reconciliationRequired;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
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

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public List<String> getShortages() {
        return shortages;
    }

    public void setShortages(List<String> shortages) {
        this.shortages = shortages;
    }

    public boolean isReconciliationRequired() {
        return reconciliationRequired;
    }

    public void setReconciliationRequired(boolean reconciliationRequired) {
        this.reconciliationRequired = reconciliationRequired;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
