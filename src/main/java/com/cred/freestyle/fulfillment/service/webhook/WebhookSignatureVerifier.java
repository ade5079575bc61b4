package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.config.WebhookProperties;
import com.cred.freestyle.fulfillment.config.WebhookProperties.ProviderSettings;
import com.cred.freestyle.fulfillment.domain.webhook.MacAlgorithm;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.exception.InvalidWebhookSignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies that a webhook body was signed by the provider it claims to come from.
 *
 * The MAC is computed over the exact received bytes with the provider's secret and algorithm,
 * hex encoded, and compared in constant time. Fails closed: a provider without a configured
 * secret, a missing header or a mismatch all raise {@link InvalidWebhookSignatureException}.
 *
 * @author Fulfillment Team
 */
@Service
public class WebhookSignatureVerifier {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    private final WebhookProperties properties;

    public WebhookSignatureVerifier(WebhookProperties properties) {
        this.properties = properties;
    }

    /**
     * Name of the header carrying the signature for a provider.
     *
     * @param provider Payment provider
     * @return Configured header name, or the provider default
     */
    public String signatureHeader(PaymentProvider provider) {
        return properties.settingsFor(provider)
                .map(ProviderSettings::getSignatureHeader)
                .filter(header -> !header.isBlank())
                .orElse(provider.defaultSignatureHeader());
    }

    /**
     * Verify a webhook signature.
     *
     * @param provider Claimed provider
     * @param rawBody Request body exactly as received
     * @param signature Signature header value, may be null
     * @throws InvalidWebhookSignatureException if the signature cannot be verified
     */
    public void verify(PaymentProvider provider, byte[] rawBody, String signature) {
        ProviderSettings settings = properties.settingsFor(provider).orElse(null);
        String secret = settings != null ? settings.getSecret() : null;

        if (secret == null || secret.isBlank()) {
            logger.error("No webhook secret configured for provider {}, rejecting webhook", provider.key());
            throw new InvalidWebhookSignatureException(provider.key(), "missing_secret");
        }
        if (signature == null || signature.isBlank()) {
            logger.warn("Webhook from {} has no {} header", provider.key(), signatureHeader(provider));
            throw new InvalidWebhookSignatureException(provider.key(), "missing_signature");
        }

        MacAlgorithm algorithm = settings.getAlgorithm() != null ? settings.getAlgorithm() : provider.defaultAlgorithm();
        String expected = sign(algorithm, secret, rawBody == null ? new byte[0] : rawBody);
        String received = signature.trim().toLowerCase(Locale.ROOT);

        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                received.getBytes(StandardCharsets.US_ASCII));

        if (!matches) {
            logger.warn("Webhook signature mismatch for provider {}", provider.key());
            throw new InvalidWebhookSignatureException(provider.key(), "mismatch");
        }
    }

    /**
     * Compute the lower-case hex MAC of a body.
     *
     * @param algorithm MAC algorithm
     * @param secret Shared secret
     * @param body Bytes to sign
     * @return Hex encoded MAC
     */
    static String sign(MacAlgorithm algorithm, String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm.jcaName()));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("MAC algorithm unavailable: " + algorithm, e);
        }
    }
}
