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
@ConfigurationProperties(prefix = "riskcast.cache")
@Data
@Validated
public class CacheProperties {

    private Local local = new Local();
    private Shared shared = new Shared();
    private Prefetch prefetch = new Prefetch();

    @Data
    public static class Local {
        @Positive
        private long maxSize = 10_000;

        @Positive
        private long sweepIntervalMs = 30_000;
    }

    @Data
    public static class Shared {
        private boolean enabled = false;
        private String keyPrefix = "riskcast:";
        private long maxInMemoryEntries = 50_000;
    }

    @Data
    public static class Prefetch {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 60_000;

        @Min(1)
        private long popularityThreshold = 5;

        @Min(1)
        private int maxItems = 50;

        @NotNull
        private Duration refreshAhead = Duration.ofSeconds(60);
    }
}
