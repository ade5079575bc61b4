package com.cred.freestyle.fulfillment.exception;

/**
 * Exception thrown when delivery provisioning cannot allocate enough stock items for an order item.
 * Only raised after commit; the dispatcher logs it and moves on to the next item.
 *
 * @author Fulfillment Team
 */
public class OutOfStockException extends RuntimeException {

    private final String planId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public OutOfStockException(String planId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Plan %s is out of stock. Requested: %d, Available: %d",
                planId, requestedQuantity, availableQuantity));
        this.planId = planId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public String getPlanId() {
        return planId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
