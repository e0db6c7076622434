package com.riskcast.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.IntStream;

@Configuration
@ConfigurationProperties(prefix = "riskcast.router")
@Data
@Validated
public class RouterProperties {

    @NotEmpty
    private List<Integer> supportedHorizons = IntStream.rangeClosed(1, 24).boxed().toList();

    @Min(1)
    private int maxHorizonsPerRequest = 5;

    @Positive
    private int shortHorizonMaxMonths = 3;

    @Positive
    private int longHorizonMinMonths = 6;

    private boolean blendLongHorizons = false;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double degradedConfidencePenalty = 0.2;

    @DecimalMin("0.0")
    private double disagreementPenaltyFactor = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxDisagreementPenalty = 0.5;

    @DecimalMin("0.0")
    private double uncertaintyScale = 0.25;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double lowConfidenceThreshold = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double highConfidenceThreshold = 0.8;

    private Models models = new Models();

    @Data
    public static class Models {
        private String shortModelLocation = "classpath:models/tree-ensemble-short-v1.json";
        private String longModelLocation = "classpath:models/sequence-long-v1.json";
    }
}
