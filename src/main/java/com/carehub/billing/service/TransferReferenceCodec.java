package com.carehub.billing.service;

import com.carehub.billing.dto.TransferContent;
import com.carehub.billing.exception.InvalidTransferContentException;
import org.springframework.stereotype.Component;

/**
 * Formats and parses the transfer reference the gateway matches payments by.
 * <p>
 * A reference is PREFIX + SUFFIX where the prefix has 2 to 5 characters and the
 * suffix 3 to 10 decimal digits, 5 to 15 characters in total. When several splits
 * are valid, parsing picks the shortest prefix: "DH12345" is "DH" + "12345", never
 * "DH1" + "2345".
 */
@Component
public class TransferReferenceCodec {

    public static final String DEFAULT_PREFIX = "DH";

    static final int MIN_PREFIX_LENGTH = 2;
    static final int MAX_PREFIX_LENGTH = 5;
    static final int MIN_SUFFIX_LENGTH = 3;
    static final int MAX_SUFFIX_LENGTH = 10;
    static final int MIN_CONTENT_LENGTH = 5;
    static final int MAX_CONTENT_LENGTH = 15;

    private static final int ORDER_CODE_TAIL_LENGTH = 8;
    private static final int USER_ID_DIGITS = 2;

    public TransferContent generate(String orderCode, long userId) {
        return generate(orderCode, userId, null);
    }

    /**
     * Derive a reference from an order code.
     * <p>
     * The suffix is the last 8 characters of the order code. Short order codes are
     * topped up with the last two digits of the user id and then padded with '0'
     * up to 3 characters.
     *
     * @param prefix custom prefix, {@value #DEFAULT_PREFIX} when null or empty
     * @throws InvalidTransferContentException if the prefix is not 2-5 characters or
     *                                         the derived suffix is not all digits
     */
    public TransferContent generate(String orderCode, long userId, String prefix) {
        String effectivePrefix = (prefix == null || prefix.isEmpty()) ? DEFAULT_PREFIX : prefix;

        if (effectivePrefix.length() < MIN_PREFIX_LENGTH || effectivePrefix.length() > MAX_PREFIX_LENGTH) {
            throw new InvalidTransferContentException("Prefix must be between 2-5 characters");
        }

        String code = orderCode == null ? "" : orderCode;
        String suffix = code.substring(Math.max(0, code.length() - ORDER_CODE_TAIL_LENGTH));

        if (suffix.length() < MIN_SUFFIX_LENGTH) {
            String userDigits = Long.toString(Math.abs(userId));
            suffix = suffix + userDigits.substring(Math.max(0, userDigits.length() - USER_ID_DIGITS));
        }

        if (suffix.length() < MIN_SUFFIX_LENGTH) {
            StringBuilder padded = new StringBuilder(suffix);
            while (padded.length() < MIN_SUFFIX_LENGTH) {
                padded.append('0');
            }
            suffix = padded.toString();
        } else if (suffix.length() > MAX_SUFFIX_LENGTH) {
            suffix = suffix.substring(suffix.length() - MAX_SUFFIX_LENGTH);
        }

        if (!isDigits(suffix)) {
            throw new InvalidTransferContentException(
                    "Order code " + orderCode + " does not end in a numeric reference suffix");
        }

        return TransferContent.builder()
                .prefix(effectivePrefix)
                .suffix(suffix)
                .fullContent(effectivePrefix + suffix)
                .valid(true)
                .build();
    }

    public boolean validate(String content) {
        return parse(content).isValid();
    }

    /**
     * Split a reference into prefix and suffix, trying prefix lengths 2 through 5
     * and returning the first split whose remainder is a valid numeric suffix.
     */
    public TransferContent parse(String content) {
        if (content == null
                || content.length() < MIN_CONTENT_LENGTH
                || content.length() > MAX_CONTENT_LENGTH) {
            return TransferContent.invalid();
        }

        for (int prefixLength = MIN_PREFIX_LENGTH; prefixLength <= MAX_PREFIX_LENGTH; prefixLength++) {
            String prefix = content.substring(0, prefixLength);
            String suffix = content.substring(prefixLength);

            if (suffix.length() >= MIN_SUFFIX_LENGTH
                    && suffix.length() <= MAX_SUFFIX_LENGTH
                    && isDigits(suffix)) {
                return TransferContent.builder()
                        .prefix(prefix)
                        .suffix(suffix)
                        .fullContent(content)
                        .valid(true)
                        .build();
            }
        }

        return TransferContent.invalid();
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
