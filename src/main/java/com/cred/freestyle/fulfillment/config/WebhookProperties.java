package com.cred.freestyle.fulfillment.config;

import com.cred.freestyle.fulfillment.domain.webhook.MacAlgorithm;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Webhook settings bound from {@code storefront.webhooks.*}.
 *
 * <pre>
 * storefront.webhooks.providers.cryptomus.secret=${CRYPTOMUS_WEBHOOK_SECRET:}
 * storefront.webhooks.providers.weepay.signature-header=X-Weepay-Signature
 * storefront.webhooks.replay-cache.ttl=PT24H
 * </pre>
 *
 * @author Fulfillment Team
 */
@Validated
@ConfigurationProperties(prefix = "storefront.webhooks")
public class WebhookProperties {

    /**
     * Per-provider settings keyed by provider key ("cryptomus", "weepay").
     */
    @NotNull
    private Map<String, ProviderSettings> providers = new HashMap<>();

    @Valid
    @NotNull
    private ReplayCache replayCache = new ReplayCache();

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    public ReplayCache getReplayCache() {
        return replayCache;
    }

    public void setReplayCache(ReplayCache replayCache) {
        this.replayCache = replayCache;
    }

    /**
     * Settings of a provider, or empty if the deployment does not configure it.
     *
     * @param provider Payment provider
     * @return Optional provider settings
     */
    public Optional<ProviderSettings> settingsFor(PaymentProvider provider) {
        return Optional.ofNullable(providers.get(provider.key()));
    }

    public static class ProviderSettings {

        private String secret;

        /**
         * Overrides the provider's default signature header when set.
         */
        private String signatureHeader;

        /**
         * Overrides the provider's default MAC algorithm when set.
         */
        private MacAlgorithm algorithm;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getSignatureHeader() {
            return signatureHeader;
        }

        public void setSignatureHeader(String signatureHeader) {
            this.signatureHeader = signatureHeader;
        }

        public MacAlgorithm getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(MacAlgorithm algorithm) {
            this.algorithm = algorithm;
        }

        @Override
        public String toString() {
            return "ProviderSettings{signatureHeader=" + signatureHeader + ", algorithm=" + algorithm
                    + ", secretConfigured=" + (secret != null && !secret.isBlank()) + "}";
        }
    }

    public static class ReplayCache {

        private boolean enabled = true;

        @NotNull
        private Duration ttl = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
