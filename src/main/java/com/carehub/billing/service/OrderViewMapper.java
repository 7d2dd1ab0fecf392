package com.carehub.billing.service;

import com.carehub.billing.dto.OrderView;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.entity.Appointment;
import com.carehub.billing.entity.Order;
import com.carehub.billing.entity.OrderItem;
import com.carehub.billing.entity.PatientTreatment;
import com.carehub.billing.entity.PaymentTransaction;
import com.carehub.billing.entity.User;

/**
 * Entity to read-model mapping. Must run inside the transaction that loaded
 * the entities, since it walks lazy associations.
 */
public final class OrderViewMapper {

    private OrderViewMapper() {
    }

    public static OrderView toView(Order order) {
        return OrderView.builder()
                .id(order.getId())
                .orderCode(order.getOrderCode())
                .totalAmount(order.getTotalAmount())
                .orderStatus(order.getOrderStatus())
                .notes(order.getNotes())
                .expiredAt(order.getExpiredAt())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .user(toSummary(order.getUser()))
                .appointment(toSummary(order.getAppointment()))
                .patientTreatment(toSummary(order.getPatientTreatment()))
                .items(order.getItems().stream().map(OrderViewMapper::toView).toList())
                .payments(order.getPayments().stream().map(OrderViewMapper::toView).toList())
                .build();
    }

    public static PaymentView toView(PaymentTransaction payment) {
        return PaymentView.builder()
                .id(payment.getId())
                .orderId(payment.getOrder().getId())
                .userId(payment.getUserId())
                .amount(payment.getAmount())
                .method(payment.getMethod())
                .status(payment.getStatus())
                .transactionCode(payment.getTransactionCode())
                .gatewayTransactionId(payment.getGatewayTransactionId())
                .paidAt(payment.getPaidAt())
                .expiredAt(payment.getExpiredAt())
                .createdAt(payment.getCreatedAt())
                .updatedAt(payment.getUpdatedAt())
                .build();
    }

    private static OrderView.OrderItemView toView(OrderItem item) {
        return OrderView.OrderItemView.builder()
                .id(item.getId())
                .type(item.getType())
                .referenceId(item.getReferenceId())
                .name(item.getName())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .totalPrice(item.getTotalPrice())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }

    private static OrderView.UserSummary toSummary(User user) {
        return OrderView.UserSummary.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .phoneNumber(user.getPhoneNumber())
                .build();
    }

    private static OrderView.AppointmentSummary toSummary(Appointment appointment) {
        if (appointment == null) {
            return null;
        }
        return OrderView.AppointmentSummary.builder()
                .id(appointment.getId())
                .appointmentTime(appointment.getAppointmentTime())
                .status(appointment.getStatus())
                .serviceName(appointment.getService() == null ? null : appointment.getService().getName())
                .build();
    }

    private static OrderView.PatientTreatmentSummary toSummary(PatientTreatment treatment) {
        if (treatment == null) {
            return null;
        }
        return OrderView.PatientTreatmentSummary.builder()
                .id(treatment.getId())
                .startDate(treatment.getStartDate())
                .endDate(treatment.getEndDate())
                .status(treatment.isStatus())
                .build();
    }
}
