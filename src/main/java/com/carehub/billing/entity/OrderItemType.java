package com.carehub.billing.entity;

/**
 * What an order line bills for. The line's referenceId points into the
 * matching source record when there is one.
 */
public enum OrderItemType {
    APPOINTMENT_FEE,
    MEDICINE,
    TEST,
    CONSULTATION,
    TREATMENT
}
