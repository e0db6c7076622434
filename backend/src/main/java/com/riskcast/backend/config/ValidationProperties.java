package com.riskcast.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "riskcast.validation")
@Data
@Validated
public class ValidationProperties {

    @Min(2)
    private int folds = 5;

    private long randomSeed = 42L;

    @Positive
    private int datasetSize = 1000;

    @NotEmpty
    private List<Integer> horizons = List.of(3, 6, 9, 12);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double calibrationCutoff = 0.7;

    private Target defaultTarget = new Target();

    private Map<Integer, Target> horizonTargets = new HashMap<>();

    private Schedule schedule = new Schedule();

    private Benchmark benchmark = new Benchmark();

    public Target targetFor(int horizon) {
        return horizonTargets.getOrDefault(horizon, defaultTarget);
    }

    @Data
    public static class Target {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minAccuracy = 0.85;

        @DecimalMin("0.0")
        private double maxMae = 0.1;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxCalibrationError = 0.1;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;

        @Positive
        private long intervalMs = 21_600_000;

        private boolean applyRecommendedWeights = false;
    }

    @Data
    public static class Benchmark {
        @Positive
        private int iterations = 1000;

        @Min(0)
        private int warmupIterations = 50;

        @Positive
        private int concurrency = 10;

        @NotNull
        private Duration p95Target = Duration.ofMillis(200);

        @NotNull
        private Duration p99Target = Duration.ofMillis(500);
    }
}
