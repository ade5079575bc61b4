package com.cred.freestyle.fulfillment.service.webhook;

import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.cred.freestyle.fulfillment.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PaymentWebhookService.
 * Covers the ordering of verification, parsing, mapping, resolution and dispatch.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentWebhookService Unit Tests")
class PaymentWebhookServiceTest {

    @Mock
    private WebhookSignatureVerifier signatureVerifier;

    @Mock
    private WebhookPayloadParser payloadParser;

    @Mock
    private PaymentStatusMapper statusMapper;

    @Mock
    private PaymentRecordResolver recordResolver;

    @Mock
    private FulfillmentTransactionService fulfillmentTransactionService;

    @Mock
    private PostCommitDispatcher postCommitDispatcher;

    @Mock
    private WebhookReplayCache replayCache;

    @Mock
    private FulfillmentMetricsService metricsService;

    @InjectMocks
    private PaymentWebhookService webhookService;

    private final byte[] body = "{\"uuid\":\"tx-1\",\"order_id\":\"ORD-1\",\"status\":\"paid\"}"
            .getBytes(StandardCharsets.UTF_8);

    private WebhookNotification notification;
    private ResolvedPayment resolved;

    @BeforeEach
    void setUp() {
        notification = new WebhookNotification(PaymentProvider.CRYPTOMUS, "tx-1", "ORD-1", "ORD-1", "paid",
                new String(body, StandardCharsets.UTF_8));
        resolved = new ResolvedPayment(
                payment("PAY-1", "ORD-1", PaymentStatus.PENDING),
                order("ORD-1", "user-1", OrderStatus.PENDING),
                List.of(), Map.of(), Map.of(), null, "payment_id");
    }

    // ========================================
    // Rejections
    // ========================================

    @Test
    @DisplayName("handle - Invalid signature is rejected before parsing or any lookup")
    void handle_InvalidSignature_NoFurtherWork() {
        // Given
        doThrow(new InvalidWebhookSignatureException("cryptomus", "mismatch"))
                .when(signatureVerifier).verify(PaymentProvider.CRYPTOMUS, body, "bad");

        // When / Then
        assertThatThrownBy(() -> webhookService.handle(PaymentProvider.CRYPTOMUS, body, "bad"))
                .isInstanceOf(InvalidWebhookSignatureException.class);

        verifyNoInteractions(payloadParser, statusMapper, recordResolver,
                fulfillmentTransactionService, postCommitDispatcher, replayCache);
        verify(metricsService).recordWebhookRejected("cryptomus", "signature");
        verify(metricsService).recordWebhookLatency(eq("cryptomus"), anyLong());
    }

    @Test
    @DisplayName("handle - Malformed body is rejected before resolution")
    void handle_MalformedBody_Rejected() {
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body))
                .thenThrow(new MalformedWebhookException("cryptomus", "Missing required field: status"));

        assertThatThrownBy(() -> webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig"))
                .isInstanceOf(MalformedWebhookException.class);

        verifyNoInteractions(recordResolver, fulfillmentTransactionService);
        verify(metricsService).recordWebhookRejected("cryptomus", "malformed");
    }

    @Test
    @DisplayName("handle - Unresolvable payment propagates PaymentNotFoundException")
    void handle_PaymentNotFound_Propagates() {
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(recordResolver.resolve(notification)).thenThrow(new PaymentNotFoundException(List.of("payment_id")));

        assertThatThrownBy(() -> webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig"))
                .isInstanceOf(PaymentNotFoundException.class);

        verifyNoInteractions(fulfillmentTransactionService, postCommitDispatcher);
        verify(replayCache, never()).markProcessed(any(), any(), any());
        verify(metricsService).recordWebhookRejected("cryptomus", "payment_not_found");
    }

    @Test
    @DisplayName("handle - Transaction failure is counted as internal error and not cached")
    void handle_TransactionFailure_NotCached() {
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(recordResolver.resolve(notification)).thenReturn(resolved);
        when(fulfillmentTransactionService.apply(resolved, notification, CanonicalStatus.COMPLETED))
                .thenThrow(new IllegalStateException("lock timeout"));

        assertThatThrownBy(() -> webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig"))
                .isInstanceOf(IllegalStateException.class);

        verify(replayCache, never()).markProcessed(any(), any(), any());
        verifyNoInteractions(postCommitDispatcher);
        verify(metricsService).recordWebhookRejected("cryptomus", "internal_error");
    }

    // ========================================
    // Acknowledgements
    // ========================================

    @Test
    @DisplayName("handle - NO_OP status is acknowledged without touching any record")
    void handle_NoOpStatus_Ignored() {
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.NO_OP);

        FulfillmentResult result = webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig");

        assertThat(result.getOutcome()).isEqualTo(FulfillmentOutcome.IGNORED);
        verifyNoInteractions(recordResolver, fulfillmentTransactionService, postCommitDispatcher, replayCache);
        verify(metricsService).recordOutcome("cryptomus", FulfillmentOutcome.IGNORED);
    }

    @Test
    @DisplayName("handle - Replay cache hit short-circuits as ALREADY_PROCESSED")
    void handle_ReplayCacheHit_AlreadyProcessed() {
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(replayCache.isProcessed(PaymentProvider.CRYPTOMUS, "tx-1", CanonicalStatus.COMPLETED)).thenReturn(true);

        FulfillmentResult result = webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig");

        assertThat(result.getOutcome()).isEqualTo(FulfillmentOutcome.ALREADY_PROCESSED);
        verifyNoInteractions(recordResolver, fulfillmentTransactionService, postCommitDispatcher);
        verify(metricsService).recordReplayCacheHit("cryptomus");
    }

    @Test
    @DisplayName("handle - Completed outcome is cached and dispatched after the transaction")
    void handle_Completed_Dispatched() {
        // Given
        FulfillmentResult committed = FulfillmentResult.completed(PaymentProvider.CRYPTOMUS, "PAY-1", "ORD-1",
                "ORD-ORD-1", "user-1", List.of("ITEM-1"), List.of("PLAN-1"));
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(recordResolver.resolve(notification)).thenReturn(resolved);
        when(fulfillmentTransactionService.apply(resolved, notification, CanonicalStatus.COMPLETED)).thenReturn(committed);

        // When
        FulfillmentResult result = webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig");

        // Then
        assertThat(result).isSameAs(committed);
        InOrder inOrder = inOrder(signatureVerifier, fulfillmentTransactionService, replayCache, postCommitDispatcher);
        inOrder.verify(signatureVerifier).verify(PaymentProvider.CRYPTOMUS, body, "sig");
        inOrder.verify(fulfillmentTransactionService).apply(resolved, notification, CanonicalStatus.COMPLETED);
        inOrder.verify(replayCache).markProcessed(PaymentProvider.CRYPTOMUS, "tx-1", CanonicalStatus.COMPLETED);
        inOrder.verify(postCommitDispatcher).dispatch(committed);
        verify(metricsService).recordOutcome("cryptomus", FulfillmentOutcome.COMPLETED);
    }

    @Test
    @DisplayName("handle - ALREADY_PROCESSED from the database is not dispatched")
    void handle_AlreadyProcessed_NotDispatched() {
        FulfillmentResult committed = FulfillmentResult.of(FulfillmentOutcome.ALREADY_PROCESSED,
                PaymentProvider.CRYPTOMUS, "PAY-1", "ORD-1", "ORD-ORD-1", "user-1", null);
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(recordResolver.resolve(notification)).thenReturn(resolved);
        when(fulfillmentTransactionService.apply(resolved, notification, CanonicalStatus.COMPLETED)).thenReturn(committed);

        FulfillmentResult result = webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig");

        assertThat(result.getOutcome()).isEqualTo(FulfillmentOutcome.ALREADY_PROCESSED);
        verifyNoInteractions(postCommitDispatcher);
        verify(replayCache).markProcessed(PaymentProvider.CRYPTOMUS, "tx-1", CanonicalStatus.COMPLETED);
    }

    @Test
    @DisplayName("handle - Stock conflict is dispatched so the divergence is published")
    void handle_StockConflict_Dispatched() {
        FulfillmentResult committed = FulfillmentResult.stockConflict(PaymentProvider.CRYPTOMUS, "PAY-1", "ORD-1",
                "ORD-ORD-1", "user-1", List.of(), "Stock no longer available: x");
        when(payloadParser.parse(PaymentProvider.CRYPTOMUS, body)).thenReturn(notification);
        when(statusMapper.map(PaymentProvider.CRYPTOMUS, "paid")).thenReturn(CanonicalStatus.COMPLETED);
        when(recordResolver.resolve(notification)).thenReturn(resolved);
        when(fulfillmentTransactionService.apply(resolved, notification, CanonicalStatus.COMPLETED)).thenReturn(committed);

        webhookService.handle(PaymentProvider.CRYPTOMUS, body, "sig");

        verify(postCommitDispatcher).dispatch(committed);
    }

    @Test
    @DisplayName("signatureHeader - Delegates to the verifier")
    void signatureHeader_Delegates() {
        when(signatureVerifier.signatureHeader(PaymentProvider.WEEPAY)).thenReturn("X-Weepay-Signature");

        assertThat(webhookService.signatureHeader(PaymentProvider.WEEPAY)).isEqualTo("X-Weepay-Signature");
    }
}
