package com.carehub.billing.service;

import com.carehub.billing.config.ExpirationProperties;
import com.carehub.billing.config.GatewayProperties;
import com.carehub.billing.dto.CreateOrderRequest;
import com.carehub.billing.dto.OrderResponse;
import com.carehub.billing.dto.OrderView;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.RemotePaymentRequest;
import com.carehub.billing.dto.RemotePaymentResponse;
import com.carehub.billing.dto.UpdateOrderRequest;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentMethod;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.exception.GatewayUnavailableException;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.OwnershipMismatchException;
import com.carehub.billing.exception.ResourceNotFoundException;
import com.carehub.billing.repository.AppointmentRepository;
import com.carehub.billing.repository.PatientTreatmentRepository;
import com.carehub.billing.repository.UserRepository;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates the order lifecycle around {@link OrderStore}.
 * <p>
 * Creation validates references, stores the order with its pending payment,
 * stamps the deadline, enqueues the expiration job and, for non-cash orders,
 * attaches transfer instructions. Only the store write can fail the request;
 * the steps after it degrade to warnings on the response.
 */
@Service
@Slf4j
public class OrderService {

    private final OrderStore orderStore;
    private final PaymentService paymentService;
    private final PaymentExpirationScheduler expirationScheduler;
    private final TransferInstructionService instructionService;
    private final PaymentGatewayClient gatewayClient;
    private final UserRepository userRepository;
    private final AppointmentRepository appointmentRepository;
    private final PatientTreatmentRepository patientTreatmentRepository;
    private final ExpirationProperties expirationProperties;
    private final GatewayProperties gatewayProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter ordersCreatedCounter;
    private Counter scheduleFailureCounter;

    public OrderService(OrderStore orderStore,
                        PaymentService paymentService,
                        PaymentExpirationScheduler expirationScheduler,
                        TransferInstructionService instructionService,
                        PaymentGatewayClient gatewayClient,
                        UserRepository userRepository,
                        AppointmentRepository appointmentRepository,
                        PatientTreatmentRepository patientTreatmentRepository,
                        ExpirationProperties expirationProperties,
                        GatewayProperties gatewayProperties,
                        ObjectMapper objectMapper,
                        MeterRegistry meterRegistry) {
        this.orderStore = orderStore;
        this.paymentService = paymentService;
        this.expirationScheduler = expirationScheduler;
        this.instructionService = instructionService;
        this.gatewayClient = gatewayClient;
        this.userRepository = userRepository;
        this.appointmentRepository = appointmentRepository;
        this.patientTreatmentRepository = patientTreatmentRepository;
        this.expirationProperties = expirationProperties;
        this.gatewayProperties = gatewayProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        ordersCreatedCounter = Counter.builder("billing.orders.created")
                .description("Orders created with a pending payment")
                .register(meterRegistry);

        scheduleFailureCounter = Counter.builder("billing.expiration.schedule.failures")
                .description("Orders created without an expiration job")
                .register(meterRegistry);
    }

    public OrderResponse createOrder(CreateOrderRequest request) {
        log.info("Creating order for user {} with {} items, method {}",
                request.getUserId(), request.getItems().size(), request.getMethod());

        validateReferences(request);

        OrderView created = orderStore.createOrderWithPayment(request);
        OrderView order = orderStore.updateExpiredAt(
                created.getId(), LocalDateTime.now().plus(expirationProperties.getTtl()));
        PaymentView payment = order.primaryPayment();

        List<String> warnings = new ArrayList<>();
        scheduleExpiration(order, payment, warnings);

        OrderResponse.OrderResponseBuilder response = OrderResponse.builder().order(order);
        if (payment.getMethod() != PaymentMethod.CASH) {
            attachInstructions(order, payment, response, warnings);
        }
        ordersCreatedCounter.increment();

        log.info("Order {} created: id={}, totalAmount={}, transactionCode={}",
                order.getOrderCode(), order.getId(), order.getTotalAmount(), payment.getTransactionCode());

        return response.warnings(warnings).build();
    }

    public OrderResponse getOrderById(Long id) {
        return annotate(orderStore.findById(id));
    }

    public OrderResponse getOrderByOrderCode(String orderCode) {
        return annotate(orderStore.findByOrderCode(orderCode));
    }

    public List<OrderResponse> getOrdersByUserId(Long userId) {
        return orderStore.findByUserId(userId).stream()
                .map(this::annotate)
                .toList();
    }

    public OrderResponse updateOrder(Long id, UpdateOrderRequest request) {
        OrderView current = orderStore.findById(id);
        if (current.getOrderStatus() == OrderStatus.PAID) {
            throw new InvalidRequestException("Cannot update paid order " + current.getOrderCode());
        }

        OrderView updated = orderStore.update(id, request);
        log.info("Order {} updated", updated.getOrderCode());
        return annotate(updated);
    }

    /**
     * Cancels a pending payment and drops its expiration job.
     */
    public PaymentView cancelOrder(Long paymentId) {
        PaymentView cancelled = paymentService.cancelPendingPayment(paymentId);
        try {
            expirationScheduler.cancelScheduled(paymentId);
        } catch (RuntimeException e) {
            log.warn("Could not remove expiration job for cancelled payment {}: {}", paymentId, e.getMessage());
        }
        return cancelled;
    }

    private void validateReferences(CreateOrderRequest request) {
        Long userId = request.getUserId();
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }

        Long appointmentId = request.getAppointmentId();
        if (appointmentId != null) {
            if (!appointmentRepository.existsById(appointmentId)) {
                throw new ResourceNotFoundException("Appointment", appointmentId);
            }
            if (!appointmentRepository.existsByIdAndUserId(appointmentId, userId)) {
                throw new OwnershipMismatchException("Appointment", appointmentId, userId);
            }
        }

        Long patientTreatmentId = request.getPatientTreatmentId();
        if (patientTreatmentId != null) {
            if (!patientTreatmentRepository.existsById(patientTreatmentId)) {
                throw new ResourceNotFoundException("Patient treatment", patientTreatmentId);
            }
            if (!patientTreatmentRepository.existsByIdAndPatientId(patientTreatmentId, userId)) {
                throw new OwnershipMismatchException("Patient treatment", patientTreatmentId, userId);
            }
        }
    }

    private void scheduleExpiration(OrderView order, PaymentView payment, List<String> warnings) {
        try {
            expirationScheduler.scheduleCancellation(payment.getId(), expirationProperties.getTtl());
        } catch (RuntimeException e) {
            log.error("Order {} created without expiration job for payment {}; it will stay PENDING until paid or cancelled",
                    order.getOrderCode(), payment.getId(), e);
            scheduleFailureCounter.increment();
            warnings.add(OrderResponse.WARNING_EXPIRATION_NOT_SCHEDULED);
        }
    }

    private void attachInstructions(OrderView order, PaymentView payment,
                                    OrderResponse.OrderResponseBuilder response, List<String> warnings) {
        try {
            response.bankInfo(instructionService.bankInfo(payment));
            response.paymentUrl(instructionService.paymentUrl(payment));
        } catch (RuntimeException e) {
            log.error("Could not build transfer instructions for order {}; it stays payable by reference {}",
                    order.getOrderCode(), payment.getTransactionCode(), e);
            warnings.add(OrderResponse.WARNING_TRANSFER_INSTRUCTIONS_UNAVAILABLE);
            return;
        }

        if (!gatewayProperties.isRemoteCheckoutEnabled()) {
            return;
        }

        try {
            RemotePaymentResponse checkout = gatewayClient.createRemotePayment(RemotePaymentRequest.builder()
                    .amount(payment.getAmount())
                    .transactionCode(payment.getTransactionCode())
                    .description("Payment for order " + order.getOrderCode())
                    .returnUrl(gatewayProperties.getReturnUrl())
                    .cancelUrl(gatewayProperties.getCancelUrl())
                    .build());
            orderStore.attachGatewayCheckout(payment.getId(), checkout, toJson(checkout));
            response.paymentUrl(checkout.getPaymentUrl());
        } catch (GatewayUnavailableException e) {
            log.warn("Remote checkout unavailable for order {}, falling back to transfer QR: {}",
                    order.getOrderCode(), e.getMessage());
            warnings.add(OrderResponse.WARNING_REMOTE_CHECKOUT_UNAVAILABLE);
        } catch (RuntimeException e) {
            log.error("Remote checkout failed for order {}, falling back to transfer QR",
                    order.getOrderCode(), e);
            warnings.add(OrderResponse.WARNING_REMOTE_CHECKOUT_UNAVAILABLE);
        }
    }

    private OrderResponse annotate(OrderView order) {
        OrderResponse.OrderResponseBuilder response = OrderResponse.builder().order(order);
        PaymentView payment = order.primaryPayment();
        if (payment != null
                && payment.getMethod() != PaymentMethod.CASH
                && payment.getStatus() == PaymentStatus.PENDING) {
            response.paymentUrl(instructionService.paymentUrl(payment));
        }
        return response.build();
    }

    private String toJson(RemotePaymentResponse checkout) {
        try {
            return objectMapper.writeValueAsString(checkout);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise gateway checkout response: {}", e.getMessage());
            return null;
        }
    }
}
