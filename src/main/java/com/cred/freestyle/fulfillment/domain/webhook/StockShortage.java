package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * A plan whose available stock cannot cover the quantity an order requests.
 *
 * @author Fulfillment Team
 */
public class StockShortage {

    private final String planId;
    private final String productName;
    private final String planName;
    private final long requested;
    private final long available;

    public StockShortage(String planId, String productName, String planName, long requested, long available) {
        this.planId = planId;
        this.productName = productName;
        this.planName = planName;
        this.requested = requested;
        this.available = available;
    }

    public String getPlanId() {
        return planId;
    }

    public String getProductName() {
        return productName;
    }

    public String getPlanName() {
        return planName;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }

    /**
     * Human readable description, e.g. {@code "Netflix - Premium (0/1)"} (available/requested).
     */
    public String describe() {
        return String.format("%s - %s (%d/%d)", productName, planName, available, requested);
    }
}
