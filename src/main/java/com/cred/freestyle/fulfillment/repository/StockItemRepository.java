package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.StockItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;

/**
 * Repository interface for StockItem entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface StockItemRepository extends JpaRepository<StockItem, String> {

    /**
     * Count unused stock items of a plan.
     *
     * @param planId Plan ID
     * @return Number of unused stock items
     */
    long countByPlanIdAndIsUsedFalse(String planId);

    /**
     * Lock the oldest unused stock items of a plan (FIFO allocation).
     *
     * @param planId Plan ID
     * @param pageable Page limiting the number of rows locked
     * @return Locked unused stock items, oldest first
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StockItem s WHERE s.planId = :planId AND s.isUsed = false ORDER BY s.createdAt ASC, s.stockItemId ASC")
    List<StockItem> findUnusedForUpdate(@Param("planId") String planId, Pageable pageable);

    /**
     * Count used stock items of a plan.
     *
     * @param planId Plan ID
     * @return Number of used stock items
     */
    long countByPlanIdAndIsUsedTrue(String planId);
}
