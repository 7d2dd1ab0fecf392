package com.carehub.billing.controller;

import com.carehub.billing.dto.BankTransferNotification;
import com.carehub.billing.dto.BankTransferResult;
import com.carehub.billing.dto.ExpirationQueueStatus;
import com.carehub.billing.dto.PaymentPage;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.RevenuePeriod;
import com.carehub.billing.dto.RevenueStats;
import com.carehub.billing.dto.WebhookPayload;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.carehub.billing.service.BankTransferService;
import com.carehub.billing.service.OrderService;
import com.carehub.billing.service.PaymentReportService;
import com.carehub.billing.service.PaymentService;
import com.carehub.billing.service.PaymentWebhookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for payments: the gateway webhook and bank transfer receiver, manual
 * cancellation, dashboard reports and operator access to the expiration queue.
 */
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    static final String SIGNATURE_HEADER = "x-sepay-signature";

    private final PaymentWebhookService webhookService;
    private final PaymentService paymentService;
    private final OrderService orderService;
    private final PaymentExpirationScheduler expirationScheduler;
    private final BankTransferService bankTransferService;
    private final PaymentReportService reportService;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(SIGNATURE_HEADER) String signature,
            @RequestBody WebhookPayload payload) {
        Optional<PaymentView> confirmed = webhookService.handleWebhook(payload, signature);
        if (confirmed.isPresent()) {
            return ResponseEntity.ok(Map.of(
                    "message", "Payment confirmed",
                    "paymentId", confirmed.get().getId()));
        }
        return ResponseEntity.ok(Map.of("message", "Webhook processed"));
    }

    @PostMapping("/receiver")
    public ResponseEntity<BankTransferResult> receiveBankTransfer(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody BankTransferNotification notification) {
        return ResponseEntity.ok(bankTransferService.receive(notification, authorization));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<PaymentPage> getDashboardPayments(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) PaymentStatus status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(reportService.getDashboardPayments(startDate, endDate, status, page, limit));
    }

    @GetMapping("/revenue-stats")
    public ResponseEntity<RevenueStats> getRevenueStats(
            @RequestParam(defaultValue = "month") String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(reportService.getRevenueStats(RevenuePeriod.fromValue(period), startDate, endDate));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PaymentView> cancelPayment(@PathVariable Long id) {
        log.info("Manual cancellation requested for payment {}", id);
        return ResponseEntity.ok(orderService.cancelOrder(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentView> getPayment(@PathVariable Long id) {
        return ResponseEntity.ok(paymentService.getPaymentById(id));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<List<PaymentView>> getPaymentsByUser(@PathVariable Long userId) {
        return ResponseEntity.ok(paymentService.getPaymentsByUserId(userId));
    }

    @GetMapping("/queue/status")
    public ResponseEntity<ExpirationQueueStatus> getQueueStatus() {
        return ResponseEntity.ok(expirationScheduler.getStatus());
    }

    @PostMapping("/queue/clear")
    public ResponseEntity<Map<String, Object>> clearQueue() {
        int removed = expirationScheduler.clearAll();
        return ResponseEntity.ok(Map.of("message", "Expiration queue cleared", "removed", removed));
    }
}
