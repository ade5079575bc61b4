package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for OrderItem entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, String> {

    /**
     * Find all items of an order in creation order.
     *
     * @param orderId Order ID
     * @return Order items
     */
    List<OrderItem> findByOrderIdOrderByCreatedAtAsc(String orderId);

    /**
     * Find order item by ID with pessimistic write lock.
     * Serializes concurrent provisioning attempts of the same item.
     *
     * @param orderItemId Order item ID
     * @return Optional containing the locked order item if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM OrderItem i WHERE i.orderItemId = :orderItemId")
    Optional<OrderItem> findByIdForUpdate(@Param("orderItemId") String orderItemId);

    /**
     * Sum the quantity promised to orders in a status but not yet delivered, for one plan.
     * With status COMPLETED and delivery type AUTOMATIC this is the stock that is sold
     * but not yet allocated by delivery provisioning.
     *
     * @param planId Plan ID
     * @param orderStatus Order status
     * @param deliveryType Delivery type of the plan
     * @return Undelivered quantity, zero if none
     */
    @Query("SELECT COALESCE(SUM(i.quantity), 0) FROM OrderItem i, Order o, Plan p " +
           "WHERE i.orderId = o.orderId AND p.planId = i.planId AND i.planId = :planId " +
           "AND o.status = :orderStatus AND p.deliveryType = :deliveryType AND i.deliveredAt IS NULL")
    Long sumUndeliveredQuantity(@Param("planId") String planId,
                                @Param("orderStatus") OrderStatus orderStatus,
                                @Param("deliveryType") DeliveryType deliveryType);
}
