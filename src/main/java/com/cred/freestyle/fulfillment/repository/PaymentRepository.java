package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
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
 * Repository interface for Payment entity.
 * The locking finders are the serialization point for concurrent webhook deliveries.
 *
 * @author Fulfillment Team
 */
@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    /**
     * Find payment by ID with pessimistic write lock.
     * Concurrent deliveries for the same payment wait here and observe the committed status.
     *
     * @param paymentId Payment ID
     * @return Optional containing the locked payment if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.paymentId = :paymentId")
    Optional<Payment> findByIdForUpdate(@Param("paymentId") String paymentId);

    /**
     * Find the first payment carrying a provider transaction ID.
     *
     * @param providerTransactionId Provider transaction ID
     * @return Optional containing the payment if found
     */
    Optional<Payment> findFirstByProviderTransactionId(String providerTransactionId);

    /**
     * Find payments of the order with the given order number, latest attempt first.
     *
     * @param orderNumber Order number
     * @return Payments of the order, newest first
     */
    @Query("SELECT p FROM Payment p, Order o WHERE p.orderId = o.orderId " +
           "AND o.orderNumber = :orderNumber ORDER BY p.createdAt DESC")
    List<Payment> findByOrderNumberLatestFirst(@Param("orderNumber") String orderNumber);

    /**
     * Lock all payments of an order in a given status.
     *
     * @param orderId Order ID
     * @param status Payment status
     * @return Locked payments ordered by ID
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.orderId = :orderId AND p.status = :status ORDER BY p.paymentId")
    List<Payment> findByOrderIdAndStatusForUpdate(@Param("orderId") String orderId,
                                                   @Param("status") PaymentStatus status);

    /**
     * Find payments in a status whose orders are in one of the given statuses.
     * Used to surface captured payments whose orders were cancelled or failed.
     *
     * @param paymentStatus Payment status
     * @param orderStatuses Order statuses
     * @return Matching payments, newest first
     */
    @Query("SELECT p FROM Payment p, Order o WHERE p.orderId = o.orderId " +
           "AND p.status = :paymentStatus AND o.status IN :orderStatuses ORDER BY p.updatedAt DESC")
    List<Payment> findDivergent(@Param("paymentStatus") PaymentStatus paymentStatus,
                                @Param("orderStatuses") Collection<OrderStatus> orderStatuses);
}
