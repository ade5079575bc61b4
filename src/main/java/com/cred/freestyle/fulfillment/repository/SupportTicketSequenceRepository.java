package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.SupportTicketSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for issued support ticket numbers.
 *
 * @author Fulfillment Team
 */
@Repository
public interface SupportTicketSequenceRepository extends JpaRepository<SupportTicketSequence, Long> {
}
