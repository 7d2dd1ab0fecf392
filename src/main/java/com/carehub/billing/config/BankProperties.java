package com.carehub.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Receiving bank account shown to patients paying by bank transfer.
 */
@Data
@ConfigurationProperties(prefix = "payment.bank")
public class BankProperties {

    private String accountNumber;

    private String accountName;

    private String bankName;

    private String qrBaseUrl = "https://qr.sepay.vn/img";
}
