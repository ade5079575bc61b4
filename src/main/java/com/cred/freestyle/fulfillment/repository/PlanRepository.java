package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.Plan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for Plan entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface PlanRepository extends JpaRepository<Plan, String> {

    /**
     * Lock plans by ID in ascending ID order.
     * The fixed ordering keeps two transactions locking overlapping plan sets deadlock free.
     *
     * @param planIds Plan IDs
     * @return Locked plans ordered by ID
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Plan p WHERE p.planId IN :planIds ORDER BY p.planId ASC")
    List<Plan> findAllByIdForUpdate(@Param("planIds") Collection<String> planIds);
}
