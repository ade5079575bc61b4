package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.domain.webhook.WebhookNotification;
import com.cred.freestyle.fulfillment.exception.MalformedWebhookException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Extracts identifiers and status from a provider's JSON body.
 *
 * - cryptomus: uuid (transaction), order_id (order number, or payment ID on legacy checkouts), status
 * - weepay: payment_id (transaction), order_id (payment ID), status
 *
 * @author Fulfillment Team
 */
@Component
public class WebhookPayloadParser {

    private final ObjectMapper objectMapper;

    public WebhookPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a verified webhook body.
     *
     * @param provider Provider that sent the body
     * @param rawBody Raw body bytes
     * @return Parsed notification
     * @throws MalformedWebhookException if the body is not a JSON object or lacks a required field
     */
    public WebhookNotification parse(PaymentProvider provider, byte[] rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new MalformedWebhookException(provider.key(), "Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWebhookException(provider.key(), "Webhook body must be a JSON object");
        }

        String payload = new String(rawBody, StandardCharsets.UTF_8);
        switch (provider) {
            case CRYPTOMUS: {
                String orderId = required(provider, root, "order_id");
                return new WebhookNotification(provider,
                        required(provider, root, "uuid"),
                        orderId,
                        orderId,
                        required(provider, root, "status"),
                        payload);
            }
            case WEEPAY:
                return new WebhookNotification(provider,
                        required(provider, root, "payment_id"),
                        required(provider, root, "order_id"),
                        null,
                        required(provider, root, "status"),
                        payload);
            default:
                throw new IllegalArgumentException("Unsupported provider: " + provider);
        }
    }

    private String required(PaymentProvider provider, JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new MalformedWebhookException(provider.key(), "Missing required field: " + field);
        }
        return node.asText().trim();
    }
}
