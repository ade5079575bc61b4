package com.cred.freestyle.fulfillment.api.controller;

import com.cred.freestyle.fulfillment.api.dto.WebhookAckResponse;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.exception.ResourceNotFoundException;
import com.cred.freestyle.fulfillment.service.webhook.PaymentWebhookService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment provider webhooks.
 *
 * Responses:
 * - 200 for every verified, resolvable webhook, including statuses that change nothing
 * - 400 for bodies missing required fields
 * - 401 for signature failures
 * - 404 for unknown providers or unresolvable payments
 * - 500 for anything else, so the provider retries
 *
 * @author Fulfillment Team
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class PaymentWebhookController {

    private final PaymentWebhookService webhookService;

    public PaymentWebhookController(PaymentWebhookService webhookService) {
        this.webhookService = webhookService;
    }

    /**
     * Handle a provider webhook. The body is taken as raw bytes so the signature covers exactly what was sent.
     *
     * @param providerKey Provider key from the path
     * @param rawBody Raw request body
     * @param headers Request headers
     * @return Acknowledgement with the fulfillment outcome
     */
    @PostMapping(value = "/{provider}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookAckResponse> receive(
            @PathVariable("provider") String providerKey,
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader HttpHeaders headers
    ) {
        PaymentProvider provider = PaymentProvider.fromKey(providerKey)
                .orElseThrow(() -> new ResourceNotFoundException("PaymentProvider", providerKey));

        String signature = headers.getFirst(webhookService.signatureHeader(provider));
        FulfillmentResult result = webhookService.handle(provider, rawBody == null ? new byte[0] : rawBody, signature);

        return ResponseEntity.ok(WebhookAckResponse.from(result));
    }
}
