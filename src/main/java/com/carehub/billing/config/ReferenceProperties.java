package com.carehub.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "payment.reference")
public class ReferenceProperties {

    /**
     * Prefix of generated transfer references, 2 to 5 characters.
     */
    private String prefix = "DH";
}
