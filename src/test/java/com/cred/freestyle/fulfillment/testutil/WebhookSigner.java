package com.cred.freestyle.fulfillment.testutil;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * Builds signed weepay webhook bodies for tests, using the secret from the test application.yml.
 */
public final class WebhookSigner {

    public static final String WEEPAY_SECRET = "test-weepay-secret";

    private WebhookSigner() {
    }

    public static byte[] weepayBody(String paymentId, String transactionId, String status) {
        return String.format("{\"payment_id\":\"%s\",\"order_id\":\"%s\",\"status\":\"%s\"}",
                transactionId, paymentId, status).getBytes(StandardCharsets.UTF_8);
    }

    public static String signWeepay(byte[] body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(WEEPAY_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
