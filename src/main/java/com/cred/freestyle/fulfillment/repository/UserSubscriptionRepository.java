package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.UserSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for UserSubscription entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface UserSubscriptionRepository extends JpaRepository<UserSubscription, String> {

    /**
     * Check whether a subscription was already granted for an order item.
     *
     * @param orderItemId Order item ID
     * @return true if a subscription exists
     */
    boolean existsByOrderItemId(String orderItemId);

    long countByOrderId(String orderId);
}
