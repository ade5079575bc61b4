package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.webhook.CanonicalStatus;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentOutcome;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.domain.webhook.WebhookNotification;
import com.cred.freestyle.fulfillment.exception.InvalidWebhookSignatureException;
import com.cred.freestyle.fulfillment.exception.MalformedWebhookException;
import com.cred.freestyle.fulfillment.exception.PaymentNotFoundException;
import com.cred.freestyle.fulfillment.infrastructure.cache.WebhookReplayCache;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.service.fulfillment.FulfillmentTransactionService;
import com.cred.freestyle.fulfillment.service.fulfillment.PostCommitDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for payment provider webhooks.
 *
 * Flow:
 * 1. Verify the signature over the raw body (no database access before this succeeds)
 * 2. Parse identifiers and status
 * 3. Map the status; NO_OP is acknowledged without touching any record
 * 4. Resolve the payment and its order graph
 * 5. Apply the status in the fulfillment transaction (commits on return)
 * 6. Hand the committed result to the post-commit dispatcher
 *
 * Not transactional itself: step 5 commits before step 6 starts.
 *
 * @author Fulfillment Team
 */
@Service
public class PaymentWebhookService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentWebhookService.class);

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;
    private final PaymentStatusMapper statusMapper;
    private final PaymentRecordResolver recordResolver;
    private final FulfillmentTransactionService fulfillmentTransactionService;
    private final PostCommitDispatcher postCommitDispatcher;
    private final WebhookReplayCache replayCache;
    private final FulfillmentMetricsService metricsService;

    public PaymentWebhookService(
            WebhookSignatureVerifier signatureVerifier,
            WebhookPayloadParser payloadParser,
            PaymentStatusMapper statusMapper,
            PaymentRecordResolver recordResolver,
            FulfillmentTransactionService fulfillmentTransactionService,
            PostCommitDispatcher postCommitDispatcher,
            WebhookReplayCache replayCache,
            FulfillmentMetricsService metricsService
    ) {
        this.signatureVerifier = signatureVerifier;
        this.payloadParser = payloadParser;
        this.statusMapper = statusMapper;
        this.recordResolver = recordResolver;
        this.fulfillmentTransactionService = fulfillmentTransactionService;
        this.postCommitDispatcher = postCommitDispatcher;
        this.replayCache = replayCache;
        this.metricsService = metricsService;
    }

    /**
     * Header the provider puts its signature in.
     *
     * @param provider Payment provider
     * @return Header name
     */
    public String signatureHeader(PaymentProvider provider) {
        return signatureVerifier.signatureHeader(provider);
    }

    /**
     * Handle one webhook delivery.
     *
     * @param provider Provider named in the URL
     * @param rawBody Body exactly as received
     * @param signature Signature header value, may be null
     * @return Committed result (IGNORED for NO_OP statuses)
     * @throws InvalidWebhookSignatureException if the signature is rejected
     * @throws MalformedWebhookException if the body lacks required fields
     * @throws PaymentNotFoundException if no payment matches
     */
    public FulfillmentResult handle(PaymentProvider provider, byte[] rawBody, String signature) {
        long startTime = System.currentTimeMillis();
        String providerKey = provider.key();
        metricsService.recordWebhookReceived(providerKey);

        try {
            signatureVerifier.verify(provider, rawBody, signature);
            WebhookNotification notification = payloadParser.parse(provider, rawBody);

            CanonicalStatus status = statusMapper.map(provider, notification.getRawStatus());
            if (!status.isMutating()) {
                logger.info("Acknowledged {} webhook with status '{}' for transaction {} without changes",
                        providerKey, notification.getRawStatus(), notification.getProviderTransactionId());
                metricsService.recordOutcome(providerKey, FulfillmentOutcome.IGNORED);
                return FulfillmentResult.ignored(provider);
            }

            if (replayCache.isProcessed(provider, notification.getProviderTransactionId(), status)) {
                logger.info("Replayed {} webhook for transaction {} ({}), already applied",
                        providerKey, notification.getProviderTransactionId(), status);
                metricsService.recordReplayCacheHit(providerKey);
                metricsService.recordOutcome(providerKey, FulfillmentOutcome.ALREADY_PROCESSED);
                return FulfillmentResult.of(FulfillmentOutcome.ALREADY_PROCESSED, provider,
                        null, null, null, null, null);
            }

            ResolvedPayment resolved = recordResolver.resolve(notification);
            FulfillmentResult result = fulfillmentTransactionService.apply(resolved, notification, status);

            replayCache.markProcessed(provider, notification.getProviderTransactionId(), status);
            metricsService.recordOutcome(providerKey, result.getOutcome());

            if (result.getOutcome().isMutating()) {
                postCommitDispatcher.dispatch(result);
            }

            logger.info("Processed {} webhook for payment {} (resolved by {}): {}",
                    providerKey, result.getPaymentId(), resolved.getResolvedBy(), result.getOutcome());
            return result;

        } catch (InvalidWebhookSignatureException e) {
            metricsService.recordWebhookRejected(providerKey, "signature");
            throw e;
        } catch (MalformedWebhookException e) {
            metricsService.recordWebhookRejected(providerKey, "malformed");
            throw e;
        } catch (PaymentNotFoundException e) {
            metricsService.recordWebhookRejected(providerKey, "payment_not_found");
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error handling {} webhook", providerKey, e);
            metricsService.recordWebhookRejected(providerKey, "internal_error");
            throw e;
        } finally {
            metricsService.recordWebhookLatency(providerKey, System.currentTimeMillis() - startTime);
        }
    }
}
