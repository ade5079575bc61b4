package com.cred.freestyle.fulfillment.domain.model;

/**
 * How a plan is fulfilled once paid.
 *
 * @author Fulfillment Team
 */
public enum DeliveryType {
    /**
     * Pre-stocked, one-time-use secret content (a {@link StockItem}).
     */
    AUTOMATIC,

    /**
     * Human-handled support ticket.
     */
    MANUAL
}
