package com.carehub.billing.service;

import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.WebhookPayload;
import com.carehub.billing.entity.AppointmentStatus;
import com.carehub.billing.entity.Order;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.entity.PaymentTransaction;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.ResourceNotFoundException;
import com.carehub.billing.repository.AppointmentRepository;
import com.carehub.billing.repository.OrderRepository;
import com.carehub.billing.repository.PatientTreatmentRepository;
import com.carehub.billing.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Payment state transitions.
 * <p>
 * Leaving PENDING is always a conditional update on the payment row. When two
 * writers race (webhook confirmation against expiration or manual cancel),
 * exactly one of them changes the row and the other gets a BadRequest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentTransactionRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final AppointmentRepository appointmentRepository;
    private final PatientTreatmentRepository patientTreatmentRepository;

    @Transactional(readOnly = true)
    public PaymentView getPaymentById(Long id) {
        return paymentRepository.findById(id)
                .map(OrderViewMapper::toView)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", id));
    }

    @Transactional(readOnly = true)
    public List<PaymentView> getPaymentsByUserId(Long userId) {
        return paymentRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(OrderViewMapper::toView)
                .toList();
    }

    /**
     * Confirms the PENDING payment a gateway notification refers to and marks
     * the order, appointment and treatment it pays for.
     *
     * @param reference  transaction code or order code reported by the gateway
     * @param payload    the notification
     * @param rawPayload the notification as received, kept on the payment
     * @return the confirmed payment
     */
    @Transactional
    public PaymentView confirmPayment(String reference, WebhookPayload payload, String rawPayload) {
        return confirmPayment(reference, payload.getAmount(), payload.getTransactionId(), rawPayload);
    }

    /**
     * Confirms the PENDING payment a reference points to.
     *
     * @param amount               amount paid, in the currency's smallest unit; must match exactly
     * @param gatewayTransactionId the gateway's id for the money movement
     */
    @Transactional
    public PaymentView confirmPayment(String reference, Long amount, String gatewayTransactionId, String rawPayload) {
        PaymentTransaction payment = findByReference(reference);
        Long paymentId = payment.getId();

        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new InvalidRequestException(
                    String.format("Payment %d is not pending (status: %s)", paymentId, payment.getStatus()));
        }

        if (amount == null || BigDecimal.valueOf(amount).compareTo(payment.getAmount()) != 0) {
            throw new InvalidRequestException(String.format(
                    "Amount mismatch for payment %d: expected %s, received %s",
                    paymentId, payment.getAmount().toPlainString(), amount));
        }

        Order order = payment.getOrder();
        Long orderId = order.getId();
        Long appointmentId = order.getAppointment() == null ? null : order.getAppointment().getId();
        Long patientTreatmentId = order.getPatientTreatment() == null ? null : order.getPatientTreatment().getId();

        LocalDateTime now = LocalDateTime.now();
        int updated = paymentRepository.markPaid(paymentId, now, gatewayTransactionId, rawPayload);
        if (updated == 0) {
            throw new InvalidRequestException(
                    String.format("Payment %d was resolved concurrently and cannot be confirmed", paymentId));
        }

        if (orderRepository.transitionStatus(orderId, OrderStatus.PENDING, OrderStatus.PAID, now) == 0) {
            log.warn("Order {} was not PENDING when payment {} was confirmed", orderId, paymentId);
        }
        if (appointmentId != null) {
            appointmentRepository.updateStatus(appointmentId, AppointmentStatus.PAID);
            log.debug("Appointment {} marked as paid", appointmentId);
        }
        if (patientTreatmentId != null) {
            patientTreatmentRepository.markActive(patientTreatmentId);
            log.debug("Patient treatment {} activated", patientTreatmentId);
        }

        log.info("Payment {} confirmed: orderId={}, gatewayTransactionId={}",
                paymentId, orderId, gatewayTransactionId);

        return getPaymentById(paymentId);
    }

    /**
     * Cancels a PENDING payment on request and closes its order.
     */
    @Transactional
    public PaymentView cancelPendingPayment(Long paymentId) {
        PaymentTransaction payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new InvalidRequestException(
                    String.format("Payment %d cannot be cancelled (status: %s)", paymentId, payment.getStatus()));
        }

        Long orderId = payment.getOrder().getId();
        LocalDateTime now = LocalDateTime.now();
        if (paymentRepository.transitionStatus(paymentId, PaymentStatus.PENDING, PaymentStatus.CANCELLED, now) == 0) {
            throw new InvalidRequestException(
                    String.format("Payment %d was resolved concurrently and cannot be cancelled", paymentId));
        }
        orderRepository.transitionStatus(orderId, OrderStatus.PENDING, OrderStatus.CANCELLED, now);

        log.info("Payment {} cancelled, order {} closed", paymentId, orderId);
        return getPaymentById(paymentId);
    }

    private PaymentTransaction findByReference(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidRequestException("Payment reference is required");
        }

        Optional<PaymentTransaction> byTransactionCode = paymentRepository.findByTransactionCode(reference);
        if (byTransactionCode.isPresent()) {
            return byTransactionCode.get();
        }

        Order order = orderRepository.findWithDetailsByOrderCode(reference)
                .orElseThrow(() -> new ResourceNotFoundException("Payment with reference", reference));
        return paymentRepository.findFirstByOrderIdAndStatus(order.getId(), PaymentStatus.PENDING)
                .orElseThrow(() -> new InvalidRequestException(
                        String.format("Order %s has no pending payment", reference)));
    }
}
