package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of expiration jobs in each lifecycle bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpirationQueueStatus {

    private long waiting;
    private long active;
    private long completed;
    private long failed;
}
