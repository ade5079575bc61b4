package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.domain.model.DeliveryType;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.OrderItem;
import com.cred.freestyle.fulfillment.domain.model.Plan;
import com.cred.freestyle.fulfillment.domain.webhook.StockShortage;
import com.cred.freestyle.fulfillment.repository.OrderItemRepository;
import com.cred.freestyle.fulfillment.repository.PlanRepository;
import com.cred.freestyle.fulfillment.repository.ProductRepository;
import com.cred.freestyle.fulfillment.repository.StockItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.cred.freestyle.fulfillment.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StockAvailabilityChecker.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StockAvailabilityChecker Unit Tests")
class StockAvailabilityCheckerTest {

    @Mock
    private PlanRepository planRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private StockItemRepository stockItemRepository;

    @Mock
    private OrderItemRepository orderItemRepository;

    @InjectMocks
    private StockAvailabilityChecker checker;

    private Plan automaticPlan;
    private Plan manualPlan;

    @BeforeEach
    void setUp() {
        automaticPlan = plan("PLAN-A", "PROD-1", DeliveryType.AUTOMATIC);
        automaticPlan.setName("Premium");
        manualPlan = plan("PLAN-M", "PROD-2", DeliveryType.MANUAL);
    }

    // ========================================
    // availableStock() Tests
    // ========================================

    @Test
    @DisplayName("availableStock - Unused stock minus undelivered quantity of completed orders")
    void availableStock_SubtractsPromised() {
        when(stockItemRepository.countByPlanIdAndIsUsedFalse("PLAN-A")).thenReturn(5L);
        when(orderItemRepository.sumUndeliveredQuantity("PLAN-A", OrderStatus.COMPLETED, DeliveryType.AUTOMATIC))
                .thenReturn(3L);

        assertThat(checker.availableStock("PLAN-A")).isEqualTo(2);
    }

    @Test
    @DisplayName("availableStock - Never negative when more is promised than stocked")
    void availableStock_NeverNegative() {
        when(stockItemRepository.countByPlanIdAndIsUsedFalse("PLAN-A")).thenReturn(1L);
        when(orderItemRepository.sumUndeliveredQuantity("PLAN-A", OrderStatus.COMPLETED, DeliveryType.AUTOMATIC))
                .thenReturn(4L);

        assertThat(checker.availableStock("PLAN-A")).isZero();
    }

    // ========================================
    // findShortages() Tests
    // ========================================

    @Test
    @DisplayName("findShortages - Quantities of the same plan are added up across items")
    void findShortages_AggregatesPerPlan() {
        // Given
        OrderItem first = item("ITEM-1", "ORD-1", "PLAN-A", 1);
        OrderItem second = item("ITEM-2", "ORD-1", "PLAN-A", 1);
        when(planRepository.findAllByIdForUpdate(Set.of("PLAN-A"))).thenReturn(List.of(automaticPlan));
        when(stockItemRepository.countByPlanIdAndIsUsedFalse("PLAN-A")).thenReturn(1L);
        when(orderItemRepository.sumUndeliveredQuantity(eq("PLAN-A"), any(), any())).thenReturn(0L);
        when(productRepository.findById("PROD-1")).thenReturn(Optional.of(product("PROD-1", "Netflix")));

        // When
        List<StockShortage> shortages = checker.findShortages(List.of(first, second), Map.of("PLAN-A", automaticPlan));

        // Then
        assertThat(shortages).hasSize(1);
        StockShortage shortage = shortages.get(0);
        assertThat(shortage.getRequested()).isEqualTo(2);
        assertThat(shortage.getAvailable()).isEqualTo(1);
        assertThat(shortage.describe()).isEqualTo("Netflix - Premium (1/2)");
    }

    @Test
    @DisplayName("findShortages - Exact stock is enough")
    void findShortages_ExactStock_NoShortage() {
        OrderItem item = item("ITEM-1", "ORD-1", "PLAN-A", 2);
        when(planRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(automaticPlan));
        when(stockItemRepository.countByPlanIdAndIsUsedFalse("PLAN-A")).thenReturn(2L);
        when(orderItemRepository.sumUndeliveredQuantity(eq("PLAN-A"), any(), any())).thenReturn(0L);

        assertThat(checker.findShortages(List.of(item), Map.of("PLAN-A", automaticPlan))).isEmpty();
        verifyNoInteractions(productRepository);
    }

    @Test
    @DisplayName("findShortages - MANUAL plans are never checked or locked")
    void findShortages_ManualOnly_NoLocks() {
        OrderItem item = item("ITEM-1", "ORD-1", "PLAN-M", 3);

        assertThat(checker.findShortages(List.of(item), Map.of("PLAN-M", manualPlan))).isEmpty();
        verifyNoInteractions(planRepository, stockItemRepository, orderItemRepository);
    }

    @Test
    @DisplayName("findShortages - Product name falls back to the product ID")
    void findShortages_MissingProduct_FallsBack() {
        OrderItem item = item("ITEM-1", "ORD-1", "PLAN-A", 1);
        when(planRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(automaticPlan));
        when(stockItemRepository.countByPlanIdAndIsUsedFalse("PLAN-A")).thenReturn(0L);
        when(orderItemRepository.sumUndeliveredQuantity(eq("PLAN-A"), any(), any())).thenReturn(null);
        when(productRepository.findById("PROD-1")).thenReturn(Optional.empty());

        List<StockShortage> shortages = checker.findShortages(List.of(item), Map.of("PLAN-A", automaticPlan));

        assertThat(shortages).extracting(StockShortage::getProductName).containsExactly("PROD-1");
    }
}
