package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.webhook.CanonicalStatus;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.domain.webhook.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates provider status strings into {@link CanonicalStatus}.
 * Lookup tables are built once from each provider's status enum; anything not listed maps to NO_OP.
 *
 * @author Fulfillment Team
 */
@Component
public class PaymentStatusMapper {

    private static final Logger logger = LoggerFactory.getLogger(PaymentStatusMapper.class);

    private final Map<PaymentProvider, Map<String, CanonicalStatus>> tables = new EnumMap<>(PaymentProvider.class);

    public PaymentStatusMapper() {
        for (PaymentProvider provider : PaymentProvider.values()) {
            Map<String, CanonicalStatus> table = provider.statuses().stream()
                    .collect(Collectors.toMap(ProviderStatus::wireValue, ProviderStatus::canonical));
            tables.put(provider, Collections.unmodifiableMap(table));
        }
    }

    /**
     * Map a provider status string.
     *
     * @param provider Provider that sent the status
     * @param rawStatus Status as received, may be null
     * @return Canonical status, NO_OP for unknown values
     */
    public CanonicalStatus map(PaymentProvider provider, String rawStatus) {
        if (rawStatus == null) {
            return CanonicalStatus.NO_OP;
        }
        String normalized = rawStatus.trim().toLowerCase(Locale.ROOT);
        CanonicalStatus status = tables.get(provider).get(normalized);
        if (status == null) {
            logger.warn("Unrecognized {} status '{}', acknowledging without changes", provider.key(), normalized);
            return CanonicalStatus.NO_OP;
        }
        return status;
    }

    /**
     * Full table for a provider, wire value to canonical status.
     */
    public Map<String, CanonicalStatus> table(PaymentProvider provider) {
        return tables.get(provider);
    }
}
