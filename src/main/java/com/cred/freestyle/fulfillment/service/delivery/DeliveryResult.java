package com.cred.freestyle.fulfillment.service.delivery;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;

import java.util.List;

/**
 * Outcome of provisioning one order item.
 *
 * @author Fulfillment Team
 */
public class DeliveryResult {

    private final String orderItemId;
    private final DeliveryType deliveryType;
    private final List<String> stockItemIds;
    private final String ticketId;
    private final boolean alreadyDelivered;

    private DeliveryResult(String orderItemId, DeliveryType deliveryType, List<String> stockItemIds,
                           String ticketId, boolean alreadyDelivered) {
        this.orderItemId = orderItemId;
        this.deliveryType = deliveryType;
        this.stockItemIds = List.copyOf(stockItemIds);
        this.ticketId = ticketId;
        this.alreadyDelivered = alreadyDelivered;
    }

    public static DeliveryResult allocated(String orderItemId, List<String> stockItemIds) {
        return new DeliveryResult(orderItemId, DeliveryType.AUTOMATIC, stockItemIds, null, false);
    }

    public static DeliveryResult ticketOpened(String orderItemId, String ticketId) {
        return new DeliveryResult(orderItemId, DeliveryType.MANUAL, List.of(), ticketId, false);
    }

    public static DeliveryResult alreadyDelivered(String orderItemId, DeliveryType deliveryType) {
        return new DeliveryResult(orderItemId, deliveryType, List.of(), null, true);
    }

    public String getOrderItemId() {
        return orderItemId;
    }

    public DeliveryType getDeliveryType() {
        return deliveryType;
    }

    public List<String> getStockItemIds() {
        return stockItemIds;
    }

    public String getTicketId() {
        return ticketId;
    }

    public boolean isAlreadyDelivered() {
        return alreadyDelivered;
    }
}
