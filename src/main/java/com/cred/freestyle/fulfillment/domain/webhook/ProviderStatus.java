package com.cred.freestyle.fulfillment.domain.webhook;

/**
 * One entry of a provider's status vocabulary.
 * Implemented by one enum per provider so every known wire value is listed explicitly.
 *
 * @author Fulfillment Team
 */
public interface ProviderStatus {

    /**
     * Status string as sent by the provider, lower case.
     */
    String wireValue();

    /**
     * Canonical status this wire value maps to.
     */
    CanonicalStatus canonical();
}
