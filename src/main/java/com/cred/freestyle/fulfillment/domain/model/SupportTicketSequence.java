package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Issued support ticket number. Values come from a database sequence, so a number is never handed
 * out twice, even after tickets are deleted or when several dispatch threads open tickets at once.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "support_ticket_numbers")
@Getter
@NoArgsConstructor
public class SupportTicketSequence {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "support_ticket_number_seq")
    @SequenceGenerator(name = "support_ticket_number_seq", sequenceName = "support_ticket_number_seq", allocationSize = 1)
    @Column(name = "ticket_number_value", nullable = false)
    private Long value;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @PrePersist
    protected void onCreate() {
        issuedAt = Instant.now();
    }
}
