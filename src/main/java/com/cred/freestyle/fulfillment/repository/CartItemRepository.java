package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for CartItem entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface CartItemRepository extends JpaRepository<CartItem, String> {

    /**
     * Remove a user's cart entries for the given plans.
     *
     * @param userId User ID
     * @param planIds Plans to remove from the cart
     * @return Number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM CartItem c WHERE c.userId = :userId AND c.planId IN :planIds")
    int deleteByUserIdAndPlanIdIn(@Param("userId") String userId, @Param("planIds") Collection<String> planIds);

    List<CartItem> findByUserId(String userId);
}
