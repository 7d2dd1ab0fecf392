package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A bank-transfer reference split into its parts.
 * <p>
 * Format: PREFIX (2-5 characters) followed by SUFFIX (3-10 decimal digits).
 * Example: DH12345678
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferContent {

    private String prefix;
    private String suffix;
    private String fullContent;

    /**
     * False when the content could not be split into a valid prefix and suffix.
     */
    private boolean valid;

    public static TransferContent invalid() {
        return new TransferContent("", "", "", false);
    }
}
