package com.carehub.billing.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An order as returned by the API, annotated with transfer instructions for
 * non-cash payments. Cash orders carry neither {@code paymentUrl} nor
 * {@code bankInfo}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OrderResponse {

    public static final String WARNING_EXPIRATION_NOT_SCHEDULED = "EXPIRATION_NOT_SCHEDULED";
    public static final String WARNING_REMOTE_CHECKOUT_UNAVAILABLE = "REMOTE_CHECKOUT_UNAVAILABLE";
    public static final String WARNING_TRANSFER_INSTRUCTIONS_UNAVAILABLE = "TRANSFER_INSTRUCTIONS_UNAVAILABLE";

    @JsonUnwrapped
    private OrderView order;

    private String paymentUrl;

    private BankTransferInfo bankInfo;

    /**
     * Degradations that did not fail the request but need attention.
     */
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @JsonIgnore
    public boolean hasWarning(String warning) {
        return warnings != null && warnings.contains(warning);
    }
}
