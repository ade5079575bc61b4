package com.cred.freestyle.fulfillment.domain.webhook;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registered payment providers.
 * Each provider carries its path key, its default signature header and MAC algorithm,
 * and its status vocabulary. Header and algorithm can be overridden per deployment.
 *
 * @author Fulfillment Team
 */
public enum PaymentProvider {
    CRYPTOMUS("cryptomus", "sign", MacAlgorithm.HMAC_MD5, CryptomusStatus.values()),
    WEEPAY("weepay", "X-Weepay-Signature", MacAlgorithm.HMAC_SHA256, WeepayStatus.values());

    private final String key;
    private final String defaultSignatureHeader;
    private final MacAlgorithm defaultAlgorithm;
    private final List<ProviderStatus> statuses;

    PaymentProvider(String key, String defaultSignatureHeader, MacAlgorithm defaultAlgorithm,
                    ProviderStatus[] statuses) {
        this.key = key;
        this.defaultSignatureHeader = defaultSignatureHeader;
        this.defaultAlgorithm = defaultAlgorithm;
        this.statuses = List.of(statuses);
    }

    public String key() {
        return key;
    }

    public String defaultSignatureHeader() {
        return defaultSignatureHeader;
    }

    public MacAlgorithm defaultAlgorithm() {
        return defaultAlgorithm;
    }

    /**
     * Every status value this provider is known to send.
     */
    public List<ProviderStatus> statuses() {
        return statuses;
    }

    /**
     * Look up a provider by its URL path key, case-insensitively.
     *
     * @param key Provider key (e.g. "cryptomus")
     * @return Optional containing the provider if registered
     */
    public static Optional<PaymentProvider> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.key.equals(normalized))
                .findFirst();
    }
}
