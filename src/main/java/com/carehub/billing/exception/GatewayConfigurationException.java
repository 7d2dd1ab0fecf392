package com.carehub.billing.exception;

/**
 * Thrown when the gateway secret needed for signing is not configured.
 */
public class GatewayConfigurationException extends CareBillingException {

    public GatewayConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
