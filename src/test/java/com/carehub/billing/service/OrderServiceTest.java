package com.carehub.billing.service;

import com.carehub.billing.config.BankProperties;
import com.carehub.billing.config.ExpirationProperties;
import com.carehub.billing.config.GatewayProperties;
import com.carehub.billing.dto.CreateOrderRequest;
import com.carehub.billing.dto.OrderItemRequest;
import com.carehub.billing.dto.OrderResponse;
import com.carehub.billing.dto.OrderView;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.RemotePaymentRequest;
import com.carehub.billing.dto.RemotePaymentResponse;
import com.carehub.billing.dto.UpdateOrderRequest;
import com.carehub.billing.entity.OrderItemType;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentMethod;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.exception.GatewayConfigurationException;
import com.carehub.billing.exception.GatewayUnavailableException;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.OwnershipMismatchException;
import com.carehub.billing.exception.ResourceNotFoundException;
import com.carehub.billing.repository.AppointmentRepository;
import com.carehub.billing.repository.PatientTreatmentRepository;
import com.carehub.billing.repository.UserRepository;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for OrderService.
 */
@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final String TRANSACTION_CODE = "DH56789123";

    @Mock
    private OrderStore orderStore;

    @Mock
    private PaymentService paymentService;

    @Mock
    private PaymentExpirationScheduler expirationScheduler;

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private UserRepository userRepository;

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private PatientTreatmentRepository patientTreatmentRepository;

    private GatewayProperties gatewayProperties;
    private BankProperties bankProperties;
    private SimpleMeterRegistry meterRegistry;
    private OrderService orderService;

    @BeforeEach
    void setUp() {
        bankProperties = new BankProperties();
        bankProperties.setAccountNumber("03533664595");
        bankProperties.setAccountName("HIV CARE HUB");
        bankProperties.setBankName("TPBank");

        gatewayProperties = new GatewayProperties();
        meterRegistry = new SimpleMeterRegistry();

        orderService = new OrderService(
                orderStore,
                paymentService,
                expirationScheduler,
                new TransferInstructionService(bankProperties),
                gatewayClient,
                userRepository,
                appointmentRepository,
                patientTreatmentRepository,
                new ExpirationProperties(),
                gatewayProperties,
                new ObjectMapper(),
                meterRegistry
        );
        orderService.initMetrics();
    }

    @Nested
    @DisplayName("Order creation")
    class CreateOrderTests {

        @Test
        @DisplayName("Cash order carries no transfer instructions and schedules expiration")
        void cashOrder() {
            // Given
            stubCreation(PaymentMethod.CASH);

            // When
            OrderResponse response = orderService.createOrder(request(PaymentMethod.CASH));

            // Then
            assertThat(response.getOrder().getTotalAmount()).isEqualByComparingTo("200000");
            assertThat(response.getPaymentUrl()).isNull();
            assertThat(response.getBankInfo()).isNull();
            assertThat(response.getWarnings()).isEmpty();
            assertThat(response.getOrder().primaryPayment().getStatus()).isEqualTo(PaymentStatus.PENDING);

            InOrder inOrder = inOrder(orderStore, expirationScheduler);
            inOrder.verify(orderStore).createOrderWithPayment(any());
            inOrder.verify(orderStore).updateExpiredAt(eq(1L), any(LocalDateTime.class));
            inOrder.verify(expirationScheduler).scheduleCancellation(10L, Duration.ofHours(24));
            assertThat(meterRegistry.counter("billing.orders.created").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Bank transfer order carries QR URL and bank details with the transaction code")
        void bankTransferOrder() {
            stubCreation(PaymentMethod.BANK_TRANSFER);

            OrderResponse response = orderService.createOrder(request(PaymentMethod.BANK_TRANSFER));

            assertThat(response.getPaymentUrl())
                    .startsWith("https://qr.sepay.vn/img?")
                    .contains("acc=03533664595")
                    .contains("amount=200000")
                    .contains("des=" + TRANSACTION_CODE);
            assertThat(response.getBankInfo().getContent()).isEqualTo(TRANSACTION_CODE);
            assertThat(response.getBankInfo().getAccountName()).isEqualTo("HIV CARE HUB");
            assertThat(response.getBankInfo().getPaymentId()).isEqualTo(10L);
            verify(gatewayClient, never()).createRemotePayment(any());
        }

        @Test
        @DisplayName("Broken instruction settings keep the order and surface a warning")
        void instructionFailure() {
            bankProperties.setQrBaseUrl("qr.sepay.vn/img");
            stubCreation(PaymentMethod.BANK_TRANSFER);

            OrderResponse response = orderService.createOrder(request(PaymentMethod.BANK_TRANSFER));

            assertThat(response.getOrder().getOrderStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(response.getPaymentUrl()).isNull();
            assertThat(response.hasWarning(OrderResponse.WARNING_TRANSFER_INSTRUCTIONS_UNAVAILABLE)).isTrue();
            verify(expirationScheduler).scheduleCancellation(10L, Duration.ofHours(24));
        }

        @Test
        @DisplayName("Should fail with NotFound for an unknown user and write nothing")
        void unknownUser() {
            when(userRepository.existsById(42L)).thenReturn(false);

            assertThatThrownBy(() -> orderService.createOrder(request(PaymentMethod.CASH)))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("User 42");
            verify(orderStore, never()).createOrderWithPayment(any());
        }

        @Test
        @DisplayName("Should fail with NotFound for an unknown appointment")
        void unknownAppointment() {
            when(userRepository.existsById(42L)).thenReturn(true);
            when(appointmentRepository.existsById(5L)).thenReturn(false);
            CreateOrderRequest request = request(PaymentMethod.CASH);
            request.setAppointmentId(5L);

            assertThatThrownBy(() -> orderService.createOrder(request))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(orderStore, never()).createOrderWithPayment(any());
        }

        @Test
        @DisplayName("Should fail with Forbidden for another user's appointment")
        void foreignAppointment() {
            when(userRepository.existsById(42L)).thenReturn(true);
            when(appointmentRepository.existsById(5L)).thenReturn(true);
            when(appointmentRepository.existsByIdAndUserId(5L, 42L)).thenReturn(false);
            CreateOrderRequest request = request(PaymentMethod.CASH);
            request.setAppointmentId(5L);

            assertThatThrownBy(() -> orderService.createOrder(request))
                    .isInstanceOf(OwnershipMismatchException.class);
            verify(orderStore, never()).createOrderWithPayment(any());
        }

        @Test
        @DisplayName("Should fail with Forbidden for another user's treatment")
        void foreignTreatment() {
            when(userRepository.existsById(42L)).thenReturn(true);
            when(patientTreatmentRepository.existsById(8L)).thenReturn(true);
            when(patientTreatmentRepository.existsByIdAndPatientId(8L, 42L)).thenReturn(false);
            CreateOrderRequest request = request(PaymentMethod.CASH);
            request.setPatientTreatmentId(8L);

            assertThatThrownBy(() -> orderService.createOrder(request))
                    .isInstanceOf(OwnershipMismatchException.class);
        }

        @Test
        @DisplayName("Scheduler failure keeps the order and surfaces a warning")
        void schedulerFailure() {
            stubCreation(PaymentMethod.CASH);
            when(expirationScheduler.scheduleCancellation(10L, Duration.ofHours(24)))
                    .thenThrow(new IllegalStateException("queue down"));

            OrderResponse response = orderService.createOrder(request(PaymentMethod.CASH));

            assertThat(response.getOrder().getOrderStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(response.hasWarning(OrderResponse.WARNING_EXPIRATION_NOT_SCHEDULED)).isTrue();
            assertThat(meterRegistry.counter("billing.expiration.schedule.failures").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Remote checkout")
    class RemoteCheckoutTests {

        @BeforeEach
        void enableRemoteCheckout() {
            gatewayProperties.setRemoteCheckoutEnabled(true);
            gatewayProperties.setReturnUrl("https://app.test/return");
        }

        @Test
        @DisplayName("Should use the gateway checkout URL and store the session")
        void shouldUseGatewayCheckout() {
            stubCreation(PaymentMethod.BANK_TRANSFER);
            when(gatewayClient.createRemotePayment(any())).thenReturn(
                    new RemotePaymentResponse("https://pay.test/c/1", "GW-1"));

            OrderResponse response = orderService.createOrder(request(PaymentMethod.BANK_TRANSFER));

            assertThat(response.getPaymentUrl()).isEqualTo("https://pay.test/c/1");
            assertThat(response.getWarnings()).isEmpty();

            ArgumentCaptor<RemotePaymentRequest> captor = ArgumentCaptor.forClass(RemotePaymentRequest.class);
            verify(gatewayClient).createRemotePayment(captor.capture());
            assertThat(captor.getValue().getTransactionCode()).isEqualTo(TRANSACTION_CODE);
            assertThat(captor.getValue().getReturnUrl()).isEqualTo("https://app.test/return");
            verify(orderStore).attachGatewayCheckout(eq(10L), any(RemotePaymentResponse.class), anyString());
        }

        @Test
        @DisplayName("Should fall back to the QR URL when the gateway is unavailable")
        void shouldFallBackToQr() {
            stubCreation(PaymentMethod.BANK_TRANSFER);
            when(gatewayClient.createRemotePayment(any())).thenThrow(
                    new GatewayUnavailableException("Sepay is temporarily unavailable", "Sepay", TRANSACTION_CODE));

            OrderResponse response = orderService.createOrder(request(PaymentMethod.BANK_TRANSFER));

            assertThat(response.getPaymentUrl()).contains("des=" + TRANSACTION_CODE);
            assertThat(response.hasWarning(OrderResponse.WARNING_REMOTE_CHECKOUT_UNAVAILABLE)).isTrue();
            verify(orderStore, never()).attachGatewayCheckout(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Should keep the order when the gateway is misconfigured")
        void shouldKeepOrderWhenGatewayMisconfigured() {
            stubCreation(PaymentMethod.BANK_TRANSFER);
            when(gatewayClient.createRemotePayment(any())).thenThrow(
                    new GatewayConfigurationException("Gateway secret key is not configured"));

            OrderResponse response = orderService.createOrder(request(PaymentMethod.BANK_TRANSFER));

            assertThat(response.getOrder().getId()).isEqualTo(1L);
            assertThat(response.getPaymentUrl()).contains("des=" + TRANSACTION_CODE);
            assertThat(response.getBankInfo().getTransactionCode()).isEqualTo(TRANSACTION_CODE);
            assertThat(response.hasWarning(OrderResponse.WARNING_REMOTE_CHECKOUT_UNAVAILABLE)).isTrue();
            verify(expirationScheduler).scheduleCancellation(eq(10L), any(Duration.class));
            verify(orderStore, never()).attachGatewayCheckout(anyLong(), any(), any());
        }
    }

    @Nested
    @DisplayName("Reads and updates")
    class ReadUpdateTests {

        @Test
        @DisplayName("Pending non-cash order is annotated with its QR URL")
        void pendingTransferIsAnnotated() {
            when(orderStore.findById(1L)).thenReturn(orderView(PaymentMethod.BANK_TRANSFER, PaymentStatus.PENDING));

            assertThat(orderService.getOrderById(1L).getPaymentUrl()).contains("des=" + TRANSACTION_CODE);
        }

        @Test
        @DisplayName("Paid order is not annotated")
        void paidOrderIsNotAnnotated() {
            when(orderStore.findByUserId(42L)).thenReturn(List.of(
                    orderView(PaymentMethod.BANK_TRANSFER, PaymentStatus.SUCCESS)));

            assertThat(orderService.getOrdersByUserId(42L))
                    .singleElement()
                    .satisfies(response -> assertThat(response.getPaymentUrl()).isNull());
        }

        @Test
        @DisplayName("Should refuse to update a paid order")
        void shouldRefusePaidOrderUpdate() {
            OrderView paid = orderView(PaymentMethod.CASH, PaymentStatus.SUCCESS);
            paid.setOrderStatus(OrderStatus.PAID);
            when(orderStore.findById(1L)).thenReturn(paid);

            assertThatThrownBy(() -> orderService.updateOrder(1L, new UpdateOrderRequest("late note", null)))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("paid");
            verify(orderStore, never()).update(anyLong(), any());
        }

        @Test
        @DisplayName("Should update notes of a pending order")
        void shouldUpdatePendingOrder() {
            OrderView pending = orderView(PaymentMethod.CASH, PaymentStatus.PENDING);
            UpdateOrderRequest changes = new UpdateOrderRequest("bring ID card", null);
            when(orderStore.findById(1L)).thenReturn(pending);
            when(orderStore.update(1L, changes)).thenReturn(pending);

            orderService.updateOrder(1L, changes);

            verify(orderStore).update(1L, changes);
        }

        @Test
        @DisplayName("Cancelling an order removes its expiration job")
        void cancelRemovesJob() {
            PaymentView cancelled = PaymentView.builder().id(10L).status(PaymentStatus.CANCELLED).build();
            when(paymentService.cancelPendingPayment(10L)).thenReturn(cancelled);

            PaymentView result = orderService.cancelOrder(10L);

            assertThat(result.getStatus()).isEqualTo(PaymentStatus.CANCELLED);
            verify(expirationScheduler).cancelScheduled(10L);
        }

        @Test
        @DisplayName("Cancelling a non-pending payment does not touch the queue")
        void cancelNonPendingFails() {
            when(paymentService.cancelPendingPayment(10L))
                    .thenThrow(new InvalidRequestException("Payment 10 cannot be cancelled (status: SUCCESS)"));

            assertThatThrownBy(() -> orderService.cancelOrder(10L))
                    .isInstanceOf(InvalidRequestException.class);
            verify(expirationScheduler, never()).cancelScheduled(anyLong());
        }
    }

    private void stubCreation(PaymentMethod method) {
        OrderView created = orderView(method, PaymentStatus.PENDING);
        when(userRepository.existsById(42L)).thenReturn(true);
        when(orderStore.createOrderWithPayment(any())).thenReturn(created);
        when(orderStore.updateExpiredAt(eq(1L), any(LocalDateTime.class))).thenReturn(created);
    }

    private CreateOrderRequest request(PaymentMethod method) {
        return CreateOrderRequest.builder()
                .userId(42L)
                .items(List.of(OrderItemRequest.builder()
                        .type(OrderItemType.APPOINTMENT_FEE)
                        .referenceId(3L)
                        .name("Initial consultation")
                        .quantity(1)
                        .unitPrice(new BigDecimal("200000"))
                        .build()))
                .method(method)
                .build();
    }

    private OrderView orderView(PaymentMethod method, PaymentStatus paymentStatus) {
        PaymentView payment = PaymentView.builder()
                .id(10L)
                .orderId(1L)
                .userId(42L)
                .amount(new BigDecimal("200000.00"))
                .method(method)
                .status(paymentStatus)
                .transactionCode(TRANSACTION_CODE)
                .build();

        return OrderView.builder()
                .id(1L)
                .orderCode("DH1703123456789123")
                .totalAmount(new BigDecimal("200000.00"))
                .orderStatus(OrderStatus.PENDING)
                .payments(List.of(payment))
                .build();
    }
}
