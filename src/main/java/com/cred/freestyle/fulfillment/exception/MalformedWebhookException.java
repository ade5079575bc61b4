package com.cred.freestyle.fulfillment.exception;

/**
 * Exception thrown when a webhook body cannot be parsed or lacks a required field.
 *
 * @author Fulfillment Team
 */
public class MalformedWebhookException extends RuntimeException {

    private final String provider;

    public MalformedWebhookException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public MalformedWebhookException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
