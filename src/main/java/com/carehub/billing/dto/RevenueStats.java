package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Revenue from successful payments, grouped by {@link RevenuePeriod}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueStats {

    private RevenuePeriod period;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal totalRevenue;
    private long totalPayments;
    private List<Bucket> buckets;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bucket {

        /**
         * Bucket label, e.g. 2024-05 for a month.
         */
        private String label;
        private BigDecimal revenue;
        private long payments;
    }
}
