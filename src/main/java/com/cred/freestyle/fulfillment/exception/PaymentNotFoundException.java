package com.cred.freestyle.fulfillment.exception;

import java.util.List;

/**
 * Exception thrown when no payment matches any identifier carried by a webhook.
 * Reported to the provider as 404; retries are left to the provider's own policy.
 *
 * @author Fulfillment Team
 */
public class PaymentNotFoundException extends RuntimeException {

    private final List<String> triedStrategies;

    public PaymentNotFoundException(List<String> triedStrategies) {
        super("No payment matches the webhook identifiers (tried: " + String.join(", ", triedStrategies) + ")");
        this.triedStrategies = List.copyOf(triedStrategies);
    }

    public List<String> getTriedStrategies() {
        return triedStrategies;
    }
}
