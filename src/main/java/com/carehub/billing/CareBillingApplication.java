package com.carehub.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Care Billing Service
 * <p>
 * Order and payment back end for the clinic. Patients are billed through orders
 * that carry one pending payment; the payment is settled by a bank-transfer
 * webhook or expires automatically after the payment window closes.
 * <p>
 * Key Features:
 * - Atomic creation of order, line items and pending payment
 * - Durable delayed expiration jobs keyed by payment
 * - HMAC-verified gateway webhook reconciliation
 * - Conditional status transitions so a webhook and an expiry never both win
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
@ConfigurationPropertiesScan
public class CareBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareBillingApplication.class, args);
    }
}
