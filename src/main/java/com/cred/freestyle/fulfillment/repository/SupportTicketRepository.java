package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.SupportTicket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for SupportTicket entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface SupportTicketRepository extends JpaRepository<SupportTicket, String> {
}
