package com.cred.freestyle.fulfillment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Support ticket opened for MANUAL delivery. Handled by staff through the ticketing UI.
 *
 * @author Fulfillment Team
 */
@Entity
@Table(name = "support_tickets", indexes = {
    @Index(name = "idx_support_tickets_number", columnList = "ticket_number", unique = true),
    @Index(name = "idx_support_tickets_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportTicket {

    @Id
    @Column(name = "ticket_id", nullable = false, length = 36)
    private String ticketId;

    @Column(name = "ticket_number", nullable = false, unique = true, length = 32)
    private String ticketNumber;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "priority", nullable = false, length = 20)
    private String priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TicketStatus status;

    @Column(name = "is_auto_created", nullable = false)
    @Builder.Default
    private Boolean isAutoCreated = false;

    /**
     * Comma separated tags.
     */
    @Column(name = "tags", length = 255)
    private String tags;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (ticketId == null) {
            ticketId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();

        if (status == null) {
            status = TicketStatus.OPEN;
        }
    }

    public enum TicketStatus {
        OPEN,
        IN_PROGRESS,
        CLOSED
    }
}
