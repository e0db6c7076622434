package com.riskcast.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "riskcast.engine")
@Data
@Validated
public class EngineProperties {

    @Positive
    private int maxConcurrentRequests = 1000;

    @NotNull
    private Duration requestTimeout = Duration.ofMillis(500);

    @NotNull
    private Duration timeoutGrace = Duration.ofMillis(50);

    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);

    @NotNull
    private Duration degradedCacheTtl = Duration.ofSeconds(30);

    @Positive
    private int workerThreads = 64;

    @Positive
    private int horizonThreads = 128;

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Data
    public static class CircuitBreaker {
        @Min(1)
        private int failureThreshold = 5;

        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(30);

        @Min(1)
        private int halfOpenMaxCalls = 3;
    }
}
