package com.cred.freestyle.fulfillment.service.fulfillment;

import com.cred.freestyle.fulfillment.api.dto.ReconciliationItemResponse;
import com.cred.freestyle.fulfillment.domain.model.Order;
import com.cred.freestyle.fulfillment.domain.model.Order.OrderStatus;
import com.cred.freestyle.fulfillment.domain.model.Payment;
import com.cred.freestyle.fulfillment.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.fulfillment.repository.OrderRepository;
import com.cred.freestyle.fulfillment.repository.PaymentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lists captured payments whose orders were cancelled or failed, for support to refund or credit.
 *
 * @author Fulfillment Team
 */
@Service
public class ReconciliationService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;

    public ReconciliationService(PaymentRepository paymentRepository, OrderRepository orderRepository) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
    }

    @Transactional(readOnly = true)
    public List<ReconciliationItemResponse> findPendingReconciliation() {
        List<Payment> payments = paymentRepository.findDivergent(PaymentStatus.COMPLETED,
                EnumSet.of(OrderStatus.CANCELLED, OrderStatus.FAILED));
        Map<String, Order> orders = orderRepository.findAllById(
                        payments.stream().map(Payment::getOrderId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Order::getOrderId, Function.identity()));

        return payments.stream()
                .map(payment -> ReconciliationItemResponse.from(payment, orders.get(payment.getOrderId())))
                .collect(Collectors.toList());
    }
}
