package com.carehub.billing.entity;

public enum AppointmentStatus {
    PENDING,
    PAID,
    CHECKIN,
    COMPLETED,
    CANCELLED
}
