package com.carehub.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials and endpoints of the payment gateway (Sepay).
 */
@Data
@ConfigurationProperties(prefix = "payment.gateway")
public class GatewayProperties {

    private String name = "Sepay";

    private String apiKey;

    /**
     * Shared HMAC secret. Signing and webhook verification fail while it is blank.
     */
    private String secretKey;

    private String baseUrl = "https://api.sepay.vn";

    /**
     * When enabled, non-cash orders also open a checkout session at the gateway.
     */
    private boolean remoteCheckoutEnabled = false;

    private String returnUrl;

    private String cancelUrl;
}
