package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.model.Product;
import com.cred.freestyle.fulfillment.domain.model.User;

import java.util.List;
import java.util.Map;

/**
 * A payment with everything downstream steps read: its order, the order's items,
 * their plans and products, and the owning user. Loaded once per webhook.
 *
 * @author Fulfillment Team
 */
public class ResolvedPayment {

    private final Payment payment;
    private final Order order;
    private final List<OrderItem> items;
    private final Map<String, Plan> plansById;
    private final Map<String, Product> productsById;
    private final User user;
    private final String resolvedBy;

    public ResolvedPayment(Payment payment, Order order, List<OrderItem> items, Map<String, Plan> plansById,
                           Map<String, Product> productsById, User user, String resolvedBy) {
        this.payment = payment;
        this.order = order;
        this.items = List.copyOf(items);
        this.plansById = Map.copyOf(plansById);
        this.productsById = Map.copyOf(productsById);
        this.user = user;
        this.resolvedBy = resolvedBy;
    }

    public Payment getPayment() {
        return payment;
    }

    public Order getOrder() {
        return order;
    }

    public List<OrderItem> getItems() {
        return items;
    }

    public Plan planOf(OrderItem item) {
        Plan plan = plansById.get(item.getPlanId());
        if (plan == null) {
            throw new IllegalStateException("Plan " + item.getPlanId() + " of order item " + item.getOrderItemId() + " not found");
        }
        return plan;
    }

    /**
     * Product name of a plan, or the plan ID when the product is gone.
     */
    public String productNameOf(Plan plan) {
        Product product = productsById.get(plan.getProductId());
        return product != null ? product.getName() : plan.getPlanId();
    }

    public Map<String, Plan> getPlansById() {
        return plansById;
    }

    /**
     * Owning user, null if the account was deleted after checkout.
     */
    public User getUser() {
        return user;
    }

    /**
     * Name of the strategy that found the payment.
     */
    public String getResolvedBy() {
        return resolvedBy;
    }
}
