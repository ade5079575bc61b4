package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * MAC algorithms accepted for webhook signatures, with their JCA names.
 *
 * @author Fulfillment Team
 */
public enum MacAlgorithm {
    HMAC_MD5("HmacMD5"),
    HMAC_SHA256("HmacSHA256"),
    HMAC_SHA512("HmacSHA512");

    private final String jcaName;

    MacAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    public String jcaName() {
        return jcaName;
    }
}
