package com.cred.freestyle.fulfillment.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Order confirmation request for the mail worker.
 *
 * @author Fulfillment Team
 */
public class OrderConfirmationEmailMessage {

    private String recipient;
    private String customerName;
    private String orderNumber;
    private BigDecimal total;
    private String currency;
    private List<Line> items = new ArrayList<>();
    private Instant requestedAt;

    public OrderConfirmationEmailMessage() {
    }

    public OrderConfirmationEmailMessage(String recipient, String customerName, String orderNumber,
                                         BigDecimal total, String currency, List<Line> items) {
        this.recipient = recipient;
        this.customerName = customerName;
        this.orderNumber = orderNumber;
        this.total = total;
        this.currency = currency;
        this.items = new ArrayList<>(items);
        this.requestedAt = Instant.now();
    }

    public String getRecipient() {
        return recipient;
    }

    public void setRecipient(String recipient) {
        this.recipient = recipient;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public List<Line> getItems() {
        return items;
    }

    public void setItems(List<Line> items) {
        this.items = items;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    /**
     * One line of the confirmation: product, plan and unit price.
     */
    public static class Line {

        private String productName;
        private String planName;
        private BigDecimal price;

        public Line() {
        }

        public Line(String productName, String planName, BigDecimal price) {
            this.productName = productName;
            this.planName = planName;
            this.price = price;
        }

        public String getProductName() {
            return productName;
        }

        public void setProductName(String productName) {
            this.productName = productName;
        }

        public String getPlanName() {
            return planName;
        }

        public void setPlanName(String planName) {
            this.planName = planName;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public void setPrice(BigDecimal price) {
            this.price = price;
        }
    }
}
