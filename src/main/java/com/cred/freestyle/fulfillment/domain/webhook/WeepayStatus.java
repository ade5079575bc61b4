package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * Weepay payment status vocabulary.
 *
 * @author Fulfillment Team
 */
public enum WeepayStatus implements ProviderStatus {
    SUCCESS("success", CanonicalStatus.COMPLETED),
    COMPLETED("completed", CanonicalStatus.COMPLETED),
    PAID("paid", CanonicalStatus.COMPLETED),

    FAILED("failed", CanonicalStatus.FAILED),
    ERROR("error", CanonicalStatus.FAILED),
    DECLINED("declined", CanonicalStatus.FAILED),

    CANCELLED("cancelled", CanonicalStatus.CANCELLED),
    CANCELED("canceled", CanonicalStatus.CANCELLED),

    PENDING("pending", CanonicalStatus.NO_OP),
    PROCESSING("processing", CanonicalStatus.NO_OP),
    REFUNDED("refunded", CanonicalStatus.NO_OP);

    private final String wireValue;
    private final CanonicalStatus canonical;

    WeepayStatus(String wireValue, CanonicalStatus canonical) {
        this.wireValue = wireValue;
        this.canonical = canonical;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    @Override
    public CanonicalStatus canonical() {
        return canonical;
    }
}
