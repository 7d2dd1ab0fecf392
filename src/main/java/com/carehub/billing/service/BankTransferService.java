package com.carehub.billing.service;

import com.carehub.billing.config.GatewayProperties;
import com.carehub.billing.config.ReferenceProperties;
import com.carehub.billing.dto.BankTransferNotification;
import com.carehub.billing.dto.BankTransferResult;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.TransferContent;
import com.carehub.billing.entity.BankTransaction;
import com.carehub.billing.exception.GatewayConfigurationException;
import com.carehub.billing.exception.InvalidApiKeyException;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.repository.BankTransactionRepository;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Receives bank account movements from the gateway and settles the payments
 * they pay for.
 * <p>
 * Each notification is written to the bank transaction ledger first, in its own
 * transaction, so the ledger keeps transfers that later fail to match. An incoming
 * transfer is matched by the reference the gateway extracted ({@code code}) or,
 * when that is missing, by the first reference with the configured prefix found
 * in the transfer description. Confirmation itself goes through
 * {@link PaymentService#confirmPayment(String, Long, String, String)}, so the same
 * pending-only and exact-amount rules apply as for the signed webhook.
 */
@Service
@Slf4j
public class BankTransferService {

    static final String API_KEY_SCHEME = "Apikey ";

    private static final DateTimeFormatter TRANSACTION_DATE_FORMAT =
            DateTimeFormatter.ofPattern(BankTransferNotification.DATE_PATTERN);

    private final BankTransactionRepository bankTransactionRepository;
    private final PaymentService paymentService;
    private final PaymentExpirationScheduler expirationScheduler;
    private final TransferReferenceCodec referenceCodec;
    private final GatewayProperties gatewayProperties;
    private final ReferenceProperties referenceProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter receivedCounter;
    private Counter matchedCounter;

    public BankTransferService(BankTransactionRepository bankTransactionRepository,
                               PaymentService paymentService,
                               PaymentExpirationScheduler expirationScheduler,
                               TransferReferenceCodec referenceCodec,
                               GatewayProperties gatewayProperties,
                               ReferenceProperties referenceProperties,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry) {
        this.bankTransactionRepository = bankTransactionRepository;
        this.paymentService = paymentService;
        this.expirationScheduler = expirationScheduler;
        this.referenceCodec = referenceCodec;
        this.gatewayProperties = gatewayProperties;
        this.referenceProperties = referenceProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        receivedCounter = Counter.builder("billing.bank-transfers.received")
                .description("Bank transfer notifications recorded")
                .register(meterRegistry);

        matchedCounter = Counter.builder("billing.bank-transfers.matched")
                .description("Bank transfers that confirmed a payment")
                .register(meterRegistry);
    }

    /**
     * Records one bank transfer and, for incoming money, confirms the payment it refers to.
     *
     * @param authorization the Authorization header, {@code Apikey <key>}
     * @throws InvalidApiKeyException  if the header does not carry the configured key
     * @throws InvalidRequestException if the date is malformed, no reference can be found,
     *                                 the amount differs or the payment is no longer pending
     */
    public BankTransferResult receive(BankTransferNotification notification, String authorization) {
        verifyApiKey(authorization);
        LocalDateTime transactionDate = parseTransactionDate(notification.getTransactionDate());

        BankTransaction recorded = bankTransactionRepository.save(toLedgerEntry(notification, transactionDate));
        receivedCounter.increment();
        log.info("Bank transfer {} recorded: type={}, amount={}, code={}",
                recorded.getId(), notification.getTransferType(), notification.getTransferAmount(), notification.getCode());

        if (!notification.isIncoming()) {
            log.info("Bank transfer {} is outgoing, nothing to settle", recorded.getId());
            return BankTransferResult.builder()
                    .message("Transfer recorded")
                    .bankTransactionId(recorded.getId())
                    .build();
        }

        String reference = resolveReference(notification)
                .orElseThrow(() -> new InvalidRequestException(
                        "No transaction code provided in bank transfer " + recorded.getId()));

        PaymentView confirmed = paymentService.confirmPayment(
                reference, notification.getTransferAmount(), gatewayTransactionId(notification), toJson(notification));
        bankTransactionRepository.linkPayment(recorded.getId(), confirmed.getId());
        matchedCounter.increment();

        try {
            expirationScheduler.cancelScheduled(confirmed.getId());
        } catch (RuntimeException e) {
            log.warn("Could not remove expiration job for confirmed payment {}: {}",
                    confirmed.getId(), e.getMessage());
        }

        log.info("Bank transfer {} settled payment {} of order {}",
                recorded.getId(), confirmed.getId(), confirmed.getOrderId());

        return BankTransferResult.builder()
                .message("Payment processed successfully")
                .bankTransactionId(recorded.getId())
                .paymentId(confirmed.getId())
                .orderId(confirmed.getOrderId())
                .amount(confirmed.getAmount())
                .status(confirmed.getStatus())
                .build();
    }

    /**
     * The reference a transfer pays for: the gateway's {@code code}, else the first
     * token of the description that parses as a reference with the configured prefix.
     */
    Optional<String> resolveReference(BankTransferNotification notification) {
        String code = notification.getCode();
        if (code != null && !code.isBlank()) {
            return Optional.of(code.trim());
        }

        String content = notification.getContent();
        if (content == null || content.isBlank()) {
            log.warn("Bank transfer has neither a code nor a description");
            return Optional.empty();
        }

        for (String token : content.split("[^A-Za-z0-9]+")) {
            TransferContent parsed = referenceCodec.parse(token);
            if (parsed.isValid() && parsed.getPrefix().equalsIgnoreCase(referenceProperties.getPrefix())) {
                log.debug("Found reference {} in transfer description '{}'", parsed.getFullContent(), content);
                return Optional.of(parsed.getFullContent());
            }
        }

        log.warn("Transfer description '{}' carries no payment reference", content);
        return Optional.empty();
    }

    private void verifyApiKey(String authorization) {
        String apiKey = gatewayProperties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new GatewayConfigurationException("Gateway API key is not configured");
        }
        if (authorization == null
                || authorization.length() <= API_KEY_SCHEME.length()
                || !authorization.regionMatches(true, 0, API_KEY_SCHEME, 0, API_KEY_SCHEME.length())) {
            throw new InvalidApiKeyException("Missing API key");
        }

        byte[] presented = authorization.substring(API_KEY_SCHEME.length()).trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, apiKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected bank transfer notification: invalid API key");
            throw new InvalidApiKeyException("Invalid API key");
        }
    }

    private static LocalDateTime parseTransactionDate(String value) {
        if (value == null) {
            throw new InvalidRequestException("transactionDate is required");
        }
        try {
            return LocalDateTime.parse(value, TRANSACTION_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(
                    "transactionDate must use the format " + BankTransferNotification.DATE_PATTERN);
        }
    }

    private static BankTransaction toLedgerEntry(BankTransferNotification notification, LocalDateTime transactionDate) {
        BigDecimal amount = BigDecimal.valueOf(notification.getTransferAmount());
        boolean outgoing = BankTransferNotification.TRANSFER_OUT.equalsIgnoreCase(notification.getTransferType());

        return BankTransaction.builder()
                .gatewayReferenceId(notification.getId())
                .gateway(notification.getGateway())
                .transactionDate(transactionDate)
                .accountNumber(notification.getAccountNumber())
                .subAccount(notification.getSubAccount())
                .amountIn(notification.isIncoming() ? amount : BigDecimal.ZERO)
                .amountOut(outgoing ? amount : BigDecimal.ZERO)
                .accumulated(notification.getAccumulated() == null ? null : BigDecimal.valueOf(notification.getAccumulated()))
                .code(notification.getCode())
                .transactionContent(notification.getContent())
                .referenceNumber(notification.getReferenceCode())
                .body(notification.getDescription())
                .build();
    }

    private static String gatewayTransactionId(BankTransferNotification notification) {
        return notification.getId() != null ? String.valueOf(notification.getId()) : notification.getReferenceCode();
    }

    private String toJson(BankTransferNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise bank transfer {}: {}", notification.getId(), e.getMessage());
            return null;
        }
    }
}
