package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * Provider-neutral view of a verified webhook body.
 * Carries every identifier the provider echoed back; which of them are present depends on the provider.
 *
 * @author Fulfillment Team
 */
public class WebhookNotification {

    private final PaymentProvider provider;
    private final String providerTransactionId;
    private final String paymentId;
    private final String orderNumber;
    private final String rawStatus;
    private final String rawPayload;

    /**
     * @param provider Provider that sent the webhook
     * @param providerTransactionId The provider's own transaction ID
     * @param paymentId Candidate internal payment ID, or null if the provider never sends one
     * @param orderNumber Candidate order number, or null if the provider never sends one
     * @param rawStatus Status string exactly as received
     * @param rawPayload Raw body, stored on the payment for audit
     */
    public WebhookNotification(PaymentProvider provider, String providerTransactionId, String paymentId,
                               String orderNumber, String rawStatus, String rawPayload) {
        this.provider = provider;
        this.providerTransactionId = providerTransactionId;
        this.paymentId = paymentId;
        this.orderNumber = orderNumber;
        this.rawStatus = rawStatus;
        this.rawPayload = rawPayload;
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public String getProviderTransactionId() {
        return providerTransactionId;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public String getRawStatus() {
        return rawStatus;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    @Override
    public String toString() {
        return "WebhookNotification{provider=" + provider
                + ", providerTransactionId=" + providerTransactionId
                + ", paymentId=" + paymentId
                + ", orderNumber=" + orderNumber
                + ", rawStatus=" + rawStatus + "}";
    }
}
