package com.carehub.billing.service;

import com.carehub.billing.config.ReferenceProperties;
import com.carehub.billing.dto.CreateOrderRequest;
import com.carehub.billing.dto.OrderItemRequest;
import com.carehub.billing.dto.OrderView;
import com.carehub.billing.dto.RemotePaymentResponse;
import com.carehub.billing.dto.TransferContent;
import com.carehub.billing.dto.UpdateOrderRequest;
import com.carehub.billing.entity.Order;
import com.carehub.billing.entity.OrderItem;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.entity.PaymentTransaction;
import com.carehub.billing.exception.DuplicateReferenceException;
import com.carehub.billing.exception.ResourceNotFoundException;
import com.carehub.billing.repository.AppointmentRepository;
import com.carehub.billing.repository.OrderRepository;
import com.carehub.billing.repository.PatientTreatmentRepository;
import com.carehub.billing.repository.PaymentTransactionRepository;
import com.carehub.billing.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Persistence of the order aggregate: order, line items and payments.
 * <p>
 * Every operation returns the hydrated {@link OrderView}, built inside the
 * same transaction that read the entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderStore {

    static final String ORDER_CODE_PREFIX = "DH";
    private static final int MAX_CODE_ALLOCATION_ATTEMPTS = 5;

    private final OrderRepository orderRepository;
    private final PaymentTransactionRepository paymentRepository;
    private final UserRepository userRepository;
    private final AppointmentRepository appointmentRepository;
    private final PatientTreatmentRepository patientTreatmentRepository;
    private final TransferReferenceCodec referenceCodec;
    private final ReferenceProperties referenceProperties;

    /**
     * Creates the order, its line items and one PENDING payment in a single
     * transaction. Nothing is written if any step fails.
     */
    @Transactional
    public OrderView createOrderWithPayment(CreateOrderRequest draft) {
        BigDecimal totalAmount = calculateTotal(draft.getItems());

        String orderCode = null;
        TransferContent reference = null;
        for (int attempt = 1; attempt <= MAX_CODE_ALLOCATION_ATTEMPTS && reference == null; attempt++) {
            String candidate = nextOrderCode();
            TransferContent candidateReference =
                    referenceCodec.generate(candidate, draft.getUserId(), referenceProperties.getPrefix());

            if (orderRepository.existsByOrderCode(candidate)
                    || paymentRepository.existsByTransactionCode(candidateReference.getFullContent())) {
                log.debug("Reference collision on attempt {}: orderCode={}, transactionCode={}",
                        attempt, candidate, candidateReference.getFullContent());
                continue;
            }
            orderCode = candidate;
            reference = candidateReference;
        }

        if (reference == null) {
            throw new DuplicateReferenceException(
                    "Could not allocate a unique order reference after " + MAX_CODE_ALLOCATION_ATTEMPTS + " attempts");
        }

        Order order = Order.builder()
                .orderCode(orderCode)
                .user(userRepository.getReferenceById(draft.getUserId()))
                .appointment(draft.getAppointmentId() == null ? null
                        : appointmentRepository.getReferenceById(draft.getAppointmentId()))
                .patientTreatment(draft.getPatientTreatmentId() == null ? null
                        : patientTreatmentRepository.getReferenceById(draft.getPatientTreatmentId()))
                .totalAmount(totalAmount)
                .orderStatus(OrderStatus.PENDING)
                .notes(draft.getNotes())
                .build();

        for (OrderItemRequest item : draft.getItems()) {
            order.addItem(OrderItem.builder()
                    .type(item.getType())
                    .referenceId(item.getReferenceId())
                    .name(item.getName())
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice())
                    .totalPrice(lineTotal(item))
                    .build());
        }

        order.addPayment(PaymentTransaction.builder()
                .userId(draft.getUserId())
                .amount(totalAmount)
                .method(draft.getMethod())
                .status(PaymentStatus.PENDING)
                .transactionCode(reference.getFullContent())
                .build());

        Order saved;
        try {
            saved = orderRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReferenceException("Order reference " + orderCode + " is already in use");
        }

        log.info("Order stored: id={}, orderCode={}, totalAmount={}, items={}, transactionCode={}",
                saved.getId(), saved.getOrderCode(), saved.getTotalAmount(),
                saved.getItems().size(), reference.getFullContent());

        return OrderViewMapper.toView(saved);
    }

    @Transactional(readOnly = true)
    public OrderView findById(Long id) {
        return OrderViewMapper.toView(loadOrder(id));
    }

    @Transactional(readOnly = true)
    public OrderView findByOrderCode(String orderCode) {
        return orderRepository.findWithDetailsByOrderCode(orderCode)
                .map(OrderViewMapper::toView)
                .orElseThrow(() -> new ResourceNotFoundException("Order with code", orderCode));
    }

    /**
     * Orders of a user, newest first.
     */
    @Transactional(readOnly = true)
    public List<OrderView> findByUserId(Long userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(OrderViewMapper::toView)
                .toList();
    }

    @Transactional
    public OrderView updateStatus(Long id, OrderStatus status) {
        Order order = loadOrder(id);
        order.setOrderStatus(status);
        orderRepository.saveAndFlush(order);
        return OrderViewMapper.toView(order);
    }

    /**
     * Sets the payment deadline on the order and on its still-pending payments.
     */
    @Transactional
    public OrderView updateExpiredAt(Long id, LocalDateTime expiredAt) {
        Order order = loadOrder(id);
        order.setExpiredAt(expiredAt);
        orderRepository.saveAndFlush(order);
        paymentRepository.updatePendingExpiredAt(id, expiredAt, LocalDateTime.now());
        return findById(id);
    }

    /**
     * Applies the non-null fields of {@code changes}.
     */
    @Transactional
    public OrderView update(Long id, UpdateOrderRequest changes) {
        Order order = loadOrder(id);
        if (changes.getNotes() != null) {
            order.setNotes(changes.getNotes());
        }
        if (changes.getOrderStatus() != null) {
            order.setOrderStatus(changes.getOrderStatus());
        }
        orderRepository.saveAndFlush(order);
        return OrderViewMapper.toView(order);
    }

    /**
     * Records the checkout session the gateway opened for a payment.
     */
    @Transactional
    public void attachGatewayCheckout(Long paymentId, RemotePaymentResponse checkout, String rawResponse) {
        int updated = paymentRepository.attachGatewayCheckout(
                paymentId, checkout.getGatewayTransactionId(), rawResponse, LocalDateTime.now());
        if (updated == 0) {
            throw new ResourceNotFoundException("Payment", paymentId);
        }
    }

    static BigDecimal calculateTotal(List<OrderItemRequest> items) {
        return items.stream()
                .map(OrderStore::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal lineTotal(OrderItemRequest item) {
        return item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity()));
    }

    private Order loadOrder(Long id) {
        return orderRepository.findWithDetailsById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Order", id));
    }

    /**
     * DH + epoch millis + 3 random digits. The tail is numeric so the transfer
     * reference derived from it is always parseable.
     */
    private static String nextOrderCode() {
        int random = ThreadLocalRandom.current().nextInt(1000);
        return String.format("%s%d%03d", ORDER_CODE_PREFIX, System.currentTimeMillis(), random);
    }
}
