package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * Result of applying a webhook to a payment.
 *
 * @author Fulfillment Team
 */
public enum FulfillmentOutcome {
    /**
     * Payment and order completed, subscriptions granted.
     */
    COMPLETED(true),

    /**
     * Payment captured but stock ran out: payment COMPLETED, order CANCELLED.
     */
    STOCK_CONFLICT(true),

    FAILED(true),
    CANCELLED(true),

    /**
     * Payment was no longer PENDING; nothing changed.
     */
    ALREADY_PROCESSED(false),

    /**
     * Capture reported for a payment that had already failed or been cancelled.
     */
    LATE_CAPTURE(true),

    /**
     * Status carried no state change (NO_OP), nothing was read or written.
     */
    IGNORED(false);

    private final boolean mutating;

    FulfillmentOutcome(boolean mutating) {
        this.mutating = mutating;
    }

    public boolean isMutating() {
        return mutating;
    }

    /**
     * Whether payment and order diverge and need a refund or credit decision by support.
     */
    public boolean requiresReconciliation() {
        return this == STOCK_CONFLICT || this == LATE_CAPTURE;
    }
}
