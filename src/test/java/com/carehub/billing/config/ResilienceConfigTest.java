package com.carehub.billing.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceConfigTest {

    @Test
    @DisplayName("Gateway circuit breaker takes its settings from the registry bean")
    void gatewayCircuitBreakerSettings() {
        CircuitBreakerRegistry registry = new ResilienceConfig().circuitBreakerRegistry();

        CircuitBreakerConfig config = registry.circuitBreaker(ResilienceConfig.PAYMENT_GATEWAY).getCircuitBreakerConfig();

        assertThat(config.getSlidingWindowSize()).isEqualTo(10);
        assertThat(config.getFailureRateThreshold()).isEqualTo(50f);
        assertThat(config.getPermittedNumberOfCallsInHalfOpenState()).isEqualTo(3);
        assertThat(config.isAutomaticTransitionFromOpenToHalfOpenEnabled()).isTrue();
        assertThat(config.getWaitIntervalFunctionInOpenState().apply(1)).isEqualTo(Duration.ofSeconds(30).toMillis());
    }
}
