package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the patient needs to make the transfer by hand. {@code content} is the
 * transfer description and must be copied verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankTransferInfo {

    private String accountNumber;
    private String accountName;
    private String bankName;
    private String amount;
    private String content;
    private Long paymentId;
    private String transactionCode;
}
