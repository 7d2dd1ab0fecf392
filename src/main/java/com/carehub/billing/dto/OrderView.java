package com.carehub.billing.dto;

import com.carehub.billing.entity.AppointmentStatus;
import com.carehub.billing.entity.OrderItemType;
import com.carehub.billing.entity.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Hydrated read model of an order: the order row plus user, appointment and
 * treatment summaries, its line items and its payments.
 * <p>
 * Every store operation returns this same shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderView {

    private Long id;
    private String orderCode;
    private BigDecimal totalAmount;
    private OrderStatus orderStatus;
    private String notes;
    private LocalDateTime expiredAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    private UserSummary user;
    private AppointmentSummary appointment;
    private PatientTreatmentSummary patientTreatment;

    @Builder.Default
    private List<OrderItemView> items = new ArrayList<>();

    @Builder.Default
    private List<PaymentView> payments = new ArrayList<>();

    /**
     * The payment created together with the order.
     */
    public PaymentView primaryPayment() {
        return payments.isEmpty() ? null : payments.get(0);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserSummary {
        private Long id;
        private String name;
        private String email;
        private String phoneNumber;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppointmentSummary {
        private Long id;
        private LocalDateTime appointmentTime;
        private AppointmentStatus status;
        private String serviceName;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientTreatmentSummary {
        private Long id;
        private LocalDate startDate;
        private LocalDate endDate;
        private boolean status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderItemView {
        private Long id;
        private OrderItemType type;
        private Long referenceId;
        private String name;
        private Integer quantity;
        private BigDecimal unitPrice;
        private BigDecimal totalPrice;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
    }
}
