package com.carehub.billing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A movement on the receiving bank account pushed by the gateway.
 * <p>
 * {@code code} is the payment reference the gateway recognised in the transfer
 * description; {@code content} is the description as the payer typed it.
 * Amounts are in the currency's smallest unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankTransferNotification {

    public static final String TRANSFER_IN = "in";
    public static final String TRANSFER_OUT = "out";

    /**
     * Format of {@link #transactionDate}.
     */
    public static final String DATE_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private Long id;

    @NotBlank
    private String gateway;

    @NotBlank
    private String transactionDate;

    private String accountNumber;

    private String subAccount;

    private String code;

    private String content;

    @NotBlank
    private String transferType;

    @NotNull
    @PositiveOrZero
    private Long transferAmount;

    private Long accumulated;

    private String referenceCode;

    private String description;

    public boolean isIncoming() {
        return TRANSFER_IN.equalsIgnoreCase(transferType);
    }
}
