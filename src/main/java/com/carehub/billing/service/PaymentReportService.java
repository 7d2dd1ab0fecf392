package com.carehub.billing.service;

import com.carehub.billing.dto.PaymentPage;
import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.RevenuePeriod;
import com.carehub.billing.dto.RevenueStats;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.entity.PaymentTransaction;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only payment reports for the admin dashboard.
 * <p>
 * Date filters are inclusive calendar days: {@code endDate} covers the whole day.
 * A missing start date means "from the beginning", a missing end date "up to today".
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PaymentReportService {

    static final int MAX_PAGE_SIZE = 100;

    private static final LocalDate EARLIEST = LocalDate.of(1970, 1, 1);

    private final PaymentTransactionRepository paymentRepository;

    /**
     * Payments created in the date range, newest first.
     *
     * @param status optional status filter
     * @param page   1-based page number
     * @param limit  page size, 1 to {@value #MAX_PAGE_SIZE}
     */
    public PaymentPage getDashboardPayments(LocalDate startDate, LocalDate endDate, PaymentStatus status,
                                            int page, int limit) {
        if (page < 1) {
            throw new InvalidRequestException("page must be 1 or greater");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        LocalDateTime from = startOf(startDate);
        LocalDateTime to = endOf(endDate);
        checkRange(from, to);

        PageRequest pageRequest = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<PaymentTransaction> result = status == null
                ? paymentRepository.findCreatedBetween(from, to, pageRequest)
                : paymentRepository.findByStatusCreatedBetween(status, from, to, pageRequest);

        log.debug("Dashboard payments {}..{} status={}: {} of {}", from, to, status,
                result.getNumberOfElements(), result.getTotalElements());

        List<PaymentView> items = result.getContent().stream()
                .map(OrderViewMapper::toView)
                .toList();

        return PaymentPage.builder()
                .items(items)
                .page(page)
                .limit(limit)
                .total(result.getTotalElements())
                .totalPages(result.getTotalPages())
                .build();
    }

    /**
     * Revenue of successful payments by the day, month or year they were paid in.
     * Periods without payments are omitted.
     */
    public RevenueStats getRevenueStats(RevenuePeriod period, LocalDate startDate, LocalDate endDate) {
        LocalDateTime from = startOf(startDate);
        LocalDateTime to = endOf(endDate);
        checkRange(from, to);

        Map<String, RevenueStats.Bucket> buckets = new TreeMap<>();
        BigDecimal totalRevenue = BigDecimal.ZERO;
        long totalPayments = 0;

        for (PaymentTransaction payment : paymentRepository.findPaidBetween(from, to)) {
            RevenueStats.Bucket bucket = buckets.computeIfAbsent(period.label(payment.getPaidAt()),
                    label -> new RevenueStats.Bucket(label, BigDecimal.ZERO, 0));
            bucket.setRevenue(bucket.getRevenue().add(payment.getAmount()));
            bucket.setPayments(bucket.getPayments() + 1);

            totalRevenue = totalRevenue.add(payment.getAmount());
            totalPayments++;
        }

        log.debug("Revenue by {} for {}..{}: {} payments, total {}", period, from, to, totalPayments, totalRevenue);

        return RevenueStats.builder()
                .period(period)
                .startDate(startDate)
                .endDate(endDate)
                .totalRevenue(totalRevenue)
                .totalPayments(totalPayments)
                .buckets(new ArrayList<>(buckets.values()))
                .build();
    }

    private static LocalDateTime startOf(LocalDate startDate) {
        return (startDate == null ? EARLIEST : startDate).atStartOfDay();
    }

    private static LocalDateTime endOf(LocalDate endDate) {
        return (endDate == null ? LocalDate.now() : endDate).plusDays(1).atStartOfDay();
    }

    private static void checkRange(LocalDateTime from, LocalDateTime to) {
        if (!from.isBefore(to)) {
            throw new InvalidRequestException("startDate must not be after endDate");
        }
    }
}
