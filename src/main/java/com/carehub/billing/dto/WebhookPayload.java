package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment notification pushed by the gateway.
 * <p>
 * {@code orderId} carries the transfer reference (the payment's transaction
 * code) and {@code amount} is in the currency's smallest unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookPayload {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_CANCELLED = "CANCELLED";

    private String transactionId;
    private String orderId;
    private Long amount;
    private String status;
    private String message;
    private String signature;

    /**
     * The fields covered by the signature: everything except the signature itself.
     */
    public Map<String, Object> signedFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("transactionId", transactionId);
        fields.put("orderId", orderId);
        fields.put("amount", amount);
        fields.put("status", status);
        fields.put("message", message);
        return fields;
    }
}
