package com.carehub.billing.entity;

public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CARD,
    E_WALLET
}
