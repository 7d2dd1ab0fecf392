package com.carehub.billing.dto;

import com.carehub.billing.exception.InvalidRequestException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Granularity of revenue statistics. Each period labels a timestamp with the
 * bucket it falls in.
 */
public enum RevenuePeriod {

    DAY("yyyy-MM-dd"),
    MONTH("yyyy-MM"),
    YEAR("yyyy");

    private final DateTimeFormatter formatter;

    RevenuePeriod(String pattern) {
        this.formatter = DateTimeFormatter.ofPattern(pattern);
    }

    public String label(LocalDateTime timestamp) {
        return formatter.format(timestamp);
    }

    /**
     * @throws InvalidRequestException for anything but day, month or year
     */
    public static RevenuePeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MONTH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported period '" + value + "', expected day, month or year");
        }
    }
}
