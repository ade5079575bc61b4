package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentOutcome;
import com.cred.freestyle.fulfillment.domain.webhook.FulfillmentResult;
import com.cred.freestyle.fulfillment.domain.webhook.PaymentProvider;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.exception.OutOfStockException;
import com.cred.freestyle.fulfillment.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.fulfillment.infrastructure.messaging.events.FulfillmentEvent;
import com.cred.freestyle.fulfillment.infrastructure.metrics.FulfillmentMetricsService;
import com.cred.freestyle.fulfillment.service.delivery.DeliveryProvisioningService;
import com.cred.freestyle.fulfillment.service.notification.OrderNotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostCommitDispatcher.
 * Each side effect must run even when an earlier one fails.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PostCommitDispatcher Unit Tests")
class PostCommitDispatcherTest {

    @Mock
    private OrderNotificationService notificationService;

    @Mock
    private DeliveryProvisioningService deliveryService;

    @Mock
    private StockConflictSweeper conflictSweeper;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private FulfillmentMetricsService metricsService;

    @InjectMocks
    private PostCommitDispatcher dispatcher;

    private static FulfillmentResult completed() {
        return FulfillmentResult.completed(PaymentProvider.WEEPAY, "PAY-1", "ORD-1", "ORD-ORD-1", "user-1",
                List.of("ITEM-1", "ITEM-2"), List.of("PLAN-A"));
    }

    @Test
    @DisplayName("dispatch COMPLETED - Email, delivery per item, sweep and event all run")
    void dispatch_Completed_AllSteps() {
        // When
        dispatcher.dispatch(completed());

        // Then
        verify(notificationService).sendOrderConfirmation("ORD-1");
        verify(deliveryService).provision("ORD-1", "ITEM-1");
        verify(deliveryService).provision("ORD-1", "ITEM-2");
        verify(conflictSweeper).sweep("ORD-1", List.of("PLAN-A"));

        ArgumentCaptor<FulfillmentEvent> captor = ArgumentCaptor.forClass(FulfillmentEvent.class);
        verify(kafkaProducerService).publishFulfillmentEvent(captor.capture());
        FulfillmentEvent event = captor.getValue();
        assertThat(event.getOutcome()).isEqualTo("COMPLETED");
        assertThat(event.getProvider()).isEqualTo("weepay");
        assertThat(event.getEventId()).isNotBlank();
        assertThat(event.isReconciliationRequired()).isFalse();
        verify(metricsService, never()).recordDispatchFailure(anyString());
    }

    @Test
    @DisplayName("dispatch COMPLETED - Failing email and delivery do not stop the remaining steps")
    void dispatch_Completed_FailuresIsolated() {
        // Given
        when(notificationService.sendOrderConfirmation("ORD-1")).thenThrow(new RuntimeException("smtp down"));
        when(deliveryService.provision("ORD-1", "ITEM-1")).thenThrow(new OutOfStockException("PLAN-A", 1, 0));
        when(conflictSweeper.sweep(anyString(), anyList())).thenThrow(new RuntimeException("db down"));

        // When
        assertThatCode(() -> dispatcher.dispatch(completed())).doesNotThrowAnyException();

        // Then
        verify(deliveryService).provision("ORD-1", "ITEM-2");
        verify(kafkaProducerService).publishFulfillmentEvent(any(FulfillmentEvent.class));
        verify(metricsService).recordDispatchFailure("email");
        verify(metricsService).recordDispatchFailure("delivery");
        verify(metricsService).recordDispatchFailure("sweep");
    }

    @Test
    @DisplayName("dispatch - Event publish failure is swallowed and counted")
    void dispatch_EventFailure_Counted() {
        doThrow(new IllegalStateException("kafka down"))
                .when(kafkaProducerService).publishFulfillmentEvent(any(FulfillmentEvent.class));

        assertThatCode(() -> dispatcher.dispatch(completed())).doesNotThrowAnyException();

        verify(metricsService).recordDispatchFailure("event");
    }

    @Test
    @DisplayName("dispatch STOCK_CONFLICT - Only the event is published, flagged for reconciliation")
    void dispatch_StockConflict_EventOnly() {
        FulfillmentResult result = FulfillmentResult.stockConflict(PaymentProvider.CRYPTOMUS, "PAY-1", "ORD-1",
                "ORD-ORD-1", "user-1", List.of(new StockShortage("PLAN-A", "Netflix", "Premium", 1, 0)),
                "Stock no longer available: Netflix - Premium (0/1)");

        dispatcher.dispatch(result);

        verifyNoInteractions(notificationService, deliveryService, conflictSweeper);
        ArgumentCaptor<FulfillmentEvent> captor = ArgumentCaptor.forClass(FulfillmentEvent.class);
        verify(kafkaProducerService).publishFulfillmentEvent(captor.capture());
        assertThat(captor.getValue().isReconciliationRequired()).isTrue();
        assertThat(captor.getValue().getShortages()).containsExactly("Netflix - Premium (0/1)");
    }

    @Test
    @DisplayName("dispatch LATE_CAPTURE - Flagged for reconciliation")
    void dispatch_LateCapture_Flagged() {
        FulfillmentResult result = FulfillmentResult.of(FulfillmentOutcome.LATE_CAPTURE, PaymentProvider.WEEPAY,
                "PAY-1", "ORD-1", "ORD-ORD-1", "user-1", "Captured after order was CANCELLED");

        dispatcher.dispatch(result);

        ArgumentCaptor<FulfillmentEvent> captor = ArgumentCaptor.forClass(FulfillmentEvent.class);
        verify(kafkaProducerService).publishFulfillmentEvent(captor.capture());
        assertThat(captor.getValue().isReconciliationRequired()).isTrue();
        verifyNoInteractions(deliveryService);
    }

    @Test
    @DisplayName("dispatch - Non-mutating outcomes do nothing")
    void dispatch_NonMutating_Skipped() {
        dispatcher.dispatch(FulfillmentResult.ignored(PaymentProvider.WEEPAY));
        dispatcher.dispatch(FulfillmentResult.of(FulfillmentOutcome.ALREADY_PROCESSED, PaymentProvider.WEEPAY,
                "PAY-1", "ORD-1", "ORD-ORD-1", "user-1", null));

        verifyNoInteractions(notificationService, deliveryService, conflictSweeper, kafkaProducerService);
    }
}
