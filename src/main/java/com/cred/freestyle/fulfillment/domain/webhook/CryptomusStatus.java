package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * Cryptomus payment status vocabulary.
 *
 * @author Fulfillment Team
 */
public enum CryptomusStatus implements ProviderStatus {
    PAID("paid", CanonicalStatus.COMPLETED),
    PAID_OVER("paid_over", CanonicalStatus.COMPLETED),

    FAIL("fail", CanonicalStatus.FAILED),
    WRONG_AMOUNT("wrong_amount", CanonicalStatus.FAILED),
    SYSTEM_FAIL("system_fail", CanonicalStatus.FAILED),

    CANCEL("cancel", CanonicalStatus.CANCELLED),

    CHECK("check", CanonicalStatus.NO_OP),
    PROCESS("process", CanonicalStatus.NO_OP),
    CONFIRM_CHECK("confirm_check", CanonicalStatus.NO_OP),
    WRONG_AMOUNT_WAITING("wrong_amount_waiting", CanonicalStatus.NO_OP),
    LOCKED("locked", CanonicalStatus.NO_OP),
    // Refunds are settled by the refund flow, not by payment webhooks
    REFUND_PROCESS("refund_process", CanonicalStatus.NO_OP),
    REFUND_FAIL("refund_fail", CanonicalStatus.NO_OP),
    REFUND_PAID("refund_paid", CanonicalStatus.NO_OP);

    private final String wireValue;
    private final CanonicalStatus canonical;

    CryptomusStatus(String wireValue, CanonicalStatus canonical) {
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
