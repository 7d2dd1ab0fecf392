package com.carehub.billing.scheduler;

import com.carehub.billing.config.ExpirationProperties;
import com.carehub.billing.entity.OrderStatus;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.entity.PaymentTransaction;
import com.carehub.billing.repository.OrderRepository;
import com.carehub.billing.repository.PaymentTransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Executes the cancel-payment job: expires a payment that is still PENDING
 * once its deadline has passed.
 * <p>
 * Safe to run any number of times for the same payment. The status check and
 * the conditional update mean a payment confirmed by a webhook in the meantime
 * is left alone.
 */
@Component
@Slf4j
public class PaymentExpirationWorker {

    private final PaymentTransactionRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final ExpirationProperties expirationProperties;
    private final MeterRegistry meterRegistry;

    private Counter expiredCounter;

    public PaymentExpirationWorker(PaymentTransactionRepository paymentRepository,
                                   OrderRepository orderRepository,
                                   ExpirationProperties expirationProperties,
                                   MeterRegistry meterRegistry) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.expirationProperties = expirationProperties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        expiredCounter = Counter.builder("billing.payments.expired")
                .description("Payments expired by the cancellation job")
                .register(meterRegistry);
    }

    @Transactional
    public ExpirationOutcome expireIfDue(Long paymentId) {
        Optional<PaymentTransaction> found = paymentRepository.findById(paymentId);
        if (found.isEmpty()) {
            log.warn("Payment {} not found, skipping expiration", paymentId);
            return ExpirationOutcome.PAYMENT_NOT_FOUND;
        }

        PaymentTransaction payment = found.get();
        if (payment.getStatus() != PaymentStatus.PENDING) {
            log.info("Payment {} is not pending (status: {}), skipping expiration",
                    paymentId, payment.getStatus());
            return ExpirationOutcome.ALREADY_RESOLVED;
        }

        LocalDateTime now = LocalDateTime.now();
        LocalDateTime deadline = deadlineOf(payment);
        if (!now.isAfter(deadline)) {
            log.info("Payment {} has not expired yet (deadline {}), skipping expiration", paymentId, deadline);
            return ExpirationOutcome.NOT_YET_DUE;
        }

        Long orderId = payment.getOrder().getId();
        int updated = paymentRepository.transitionStatus(
                paymentId, PaymentStatus.PENDING, PaymentStatus.EXPIRED, now);
        if (updated == 0) {
            log.info("Payment {} was resolved concurrently, skipping expiration", paymentId);
            return ExpirationOutcome.ALREADY_RESOLVED;
        }

        orderRepository.transitionStatus(orderId, OrderStatus.PENDING, OrderStatus.EXPIRED, now);
        expiredCounter.increment();

        log.info("Payment {} expired automatically, order {} closed", paymentId, orderId);
        return ExpirationOutcome.EXPIRED;
    }

    private LocalDateTime deadlineOf(PaymentTransaction payment) {
        if (payment.getExpiredAt() != null) {
            return payment.getExpiredAt();
        }
        return payment.getCreatedAt().plus(expirationProperties.getTtl());
    }
}
