package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * Internal status every provider vocabulary is mapped onto.
 *
 * @author Fulfillment Team
 */
public enum CanonicalStatus {
    COMPLETED,
    FAILED,
    CANCELLED,

    /**
     * Acknowledge the webhook without touching any record.
     * Covers transitional, refund-processing and unrecognized provider statuses.
     */
    NO_OP;

    public boolean isMutating() {
        return this != NO_OP;
    }
}
