package com.carehub.billing.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Resilience settings for outbound calls to the payment gateway.
 * <p>
 * The circuit breaker stops hammering the gateway while it is failing so that
 * order creation falls back to the transfer-by-reference flow quickly.
 * <p>
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Gateway is failing, requests fail fast
 * - HALF_OPEN: Testing if gateway has recovered
 * <p>
 * This registry replaces the one Resilience4j would build from application
 * properties, so circuit breaker settings belong here and not in application.yml.
 */
@Configuration
public class ResilienceConfig {

    public static final String PAYMENT_GATEWAY = "paymentGateway";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }
}
