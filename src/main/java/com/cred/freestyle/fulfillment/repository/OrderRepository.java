package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Order entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find order by ID with pessimistic write lock.
     * Always taken after the payment lock of the same order.
     *
     * @param orderId Order ID
     * @return Optional containing the locked order if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") String orderId);

    /**
     * Find IDs of other orders in a status that contain items of any of the given plans
     * with the given delivery type, oldest first.
     *
     * @param planIds Plans to look for
     * @param excludedOrderId Order to exclude (the one that triggered the sweep)
     * @param status Order status, normally PENDING
     * @param deliveryType Delivery type of the plans
     * @return Competing order IDs, oldest first
     */
    @Query("SELECT o.orderId FROM Order o WHERE o.status = :status AND o.orderId <> :excludedOrderId " +
           "AND EXISTS (SELECT 1 FROM OrderItem i, Plan p WHERE i.orderId = o.orderId " +
           "AND p.planId = i.planId AND p.deliveryType = :deliveryType AND i.planId IN :planIds) " +
           "ORDER BY o.createdAt ASC")
    List<String> findCompetingOrderIds(@Param("planIds") Collection<String> planIds,
                                       @Param("excludedOrderId") String excludedOrderId,
                                       @Param("status") OrderStatus status,
                                       @Param("deliveryType") DeliveryType deliveryType);
}
