package com.riskcast.backend.service.router;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BlendMathTest {

    @Test
    void blendStaysWithinBothScoresForRandomInputs() {
        Random random = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            double a = random.nextDouble();
            double b = random.nextDouble();
            HorizonWeights weights = new HorizonWeights(random.nextDouble() + 1e-6, random.nextDouble());
            double blended = BlendMath.blend(a, b, weights);
            assertThat(blended).isBetween(Math.min(a, b), Math.max(a, b));

            double penalty = BlendMath.disagreementPenalty(a, b, 0.5, 0.5);
            double confidence = BlendMath.blendConfidence(random.nextDouble(), random.nextDouble(), penalty);
            assertThat(confidence).isBetween(0.0, 1.0);
            assertThat(BlendMath.uncertaintyHalfWidth(confidence, Math.abs(a - b), 0.25)).isBetween(0.0, 1.0);
        }
    }

    @Test
    void penaltyIsCapped() {
        assertThat(BlendMath.disagreementPenalty(0.0, 1.0, 0.8, 0.5)).isEqualTo(0.5);
        assertThat(BlendMath.disagreementPenalty(0.4, 0.5, 0.5, 0.5)).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void weightsAreNormalized() {
        HorizonWeights normalized = new HorizonWeights(2, 6).normalized();
        assertThat(normalized.shortWeight()).isEqualTo(0.25);
        assertThat(normalized.longWeight()).isEqualTo(0.75);
        assertThat(BlendMath.blend(0.0, 1.0, new HorizonWeights(2, 6))).isEqualTo(0.75);
    }

    @Test
    void rejectsInvalidWeights() {
        assertThatThrownBy(() -> new HorizonWeights(-0.1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HorizonWeights(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HorizonWeights(Double.NaN, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
