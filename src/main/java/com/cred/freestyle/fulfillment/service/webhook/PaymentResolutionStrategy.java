package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.webhook.WebhookNotification;

import java.util.Optional;
import java.util.function.Function;

/**
 * One way of locating the payment a webhook refers to.
 *
 * @author Fulfillment Team
 */
public class PaymentResolutionStrategy {

    private final String name;
    private final Function<WebhookNotification, Optional<Payment>> lookup;

    public PaymentResolutionStrategy(String name, Function<WebhookNotification, Optional<Payment>> lookup) {
        this.name = name;
        this.lookup = lookup;
    }

    public String getName() {
        return name;
    }

    /**
     * Try this strategy.
     *
     * @param notification Parsed webhook
     * @return Matching payment, or empty
     */
    public Optional<Payment> resolve(WebhookNotification notification) {
        return lookup.apply(notification);
    }
}
