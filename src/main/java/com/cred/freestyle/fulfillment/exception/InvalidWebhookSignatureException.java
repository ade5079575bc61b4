package com.cred.freestyle.fulfillment.exception;

/**
 * Exception thrown when a webhook signature is missing, unverifiable or does not match.
 * Never carries the secret or the received signature.
 *
 * @author Fulfillment Team
 */
public class InvalidWebhookSignatureException extends RuntimeException {

    private final String provider;
    private final String reason;

    public InvalidWebhookSignatureException(String provider, String reason) {
        super(String.format("Webhook signature rejected for provider %s: %s", provider, reason));
        this.provider = provider;
        this.reason = reason;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * Short machine-readable rejection reason (e.g. "missing_secret", "mismatch").
     */
    public String getReason() {
        return reason;
    }
}
