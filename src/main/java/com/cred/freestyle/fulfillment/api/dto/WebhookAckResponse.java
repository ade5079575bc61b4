package com.cred.freestyle.fulfillment.api.dto;

import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;

/**
 * Acknowledgement returned to the provider on 200.
 *
 * @author Fulfillment Team
 */
public class WebhookAckResponse {

    private boolean received;
    private String outcome;

    public WebhookAckResponse() {
    }

    public WebhookAckResponse(boolean received, String outcome) {
        this.received = received;
        this.outcome = outcome;
    }

    public static WebhookAckResponse from(FulfillmentResult result) {
        return new WebhookAckResponse(true, result.getOutcome().name());
    }

    public boolean isReceived() {
        return received;
    }

    public void setReceived(boolean received) {
        this.received = received;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }
}
