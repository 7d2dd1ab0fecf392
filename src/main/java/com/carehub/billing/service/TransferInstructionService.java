package com.carehub.billing.service;

import com.carehub.billing.config.BankProperties;
import com.carehub.billing.dto.BankTransferInfo;
import com.carehub.billing.dto.PaymentView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;

/**
 * Builds the bank-transfer instructions shown for non-cash payments.
 * <p>
 * No gateway round trip is involved: the QR image URL and the bank details are
 * derived from configuration and the payment's transaction code, which doubles
 * as the transfer description.
 */
@Service
@RequiredArgsConstructor
public class TransferInstructionService {

    private final BankProperties bankProperties;

    /**
     * URL of a QR code that pre-fills the transfer in a banking app.
     */
    public String paymentUrl(PaymentView payment) {
        return UriComponentsBuilder.fromHttpUrl(bankProperties.getQrBaseUrl())
                .queryParam("acc", bankProperties.getAccountNumber())
                .queryParam("bank", bankProperties.getBankName())
                .queryParam("amount", formatAmount(payment.getAmount()))
                .queryParam("des", payment.getTransactionCode())
                .encode()
                .toUriString();
    }

    public BankTransferInfo bankInfo(PaymentView payment) {
        return BankTransferInfo.builder()
                .accountNumber(bankProperties.getAccountNumber())
                .accountName(bankProperties.getAccountName())
                .bankName(bankProperties.getBankName())
                .amount(formatAmount(payment.getAmount()))
                .content(payment.getTransactionCode())
                .paymentId(payment.getId())
                .transactionCode(payment.getTransactionCode())
                .build();
    }

    static String formatAmount(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }
}
