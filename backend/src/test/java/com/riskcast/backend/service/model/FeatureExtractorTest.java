package com.riskcast.backend.service.model;

import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.support.TestRequests;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void mapsKnownFieldsIntoUnitRange() {
        RiskAssessmentRequest request = TestRequests.base()
                .industry("crypto")
                .country("DE")
                .predictionHorizons(List.of(12))
                .metadata(Map.of("credit_score", "850", "debt_to_equity", 10))
                .build();

        FeatureVector features = extractor.extract(request, 12);

        assertThat(features.get(0)).isEqualTo(0.90);
        assertThat(features.get(1)).isEqualTo(0.15);
        assertThat(features.get(5)).isEqualTo(1.0);
        assertThat(features.get(7)).isCloseTo(1.0, within(1e-12));
        assertThat(features.get(9)).isEqualTo(1.0);
        assertThat(features.get(FeatureVector.HORIZON_INDEX)).isEqualTo(0.5);
        assertThat(features.horizonMonths()).isEqualTo(12);
        for (double value : features.toArray()) {
            assertThat(value).isBetween(0.0, 1.0);
        }
    }

    @Test
    void unknownValuesFallBackToDefaults() {
        RiskAssessmentRequest request = TestRequests.base()
                .industry("underwater_basket_weaving")
                .country("ZZ")
                .phone(null)
                .website(null)
                .predictionHorizons(List.of(3))
                .metadata(Map.of("credit_score", "not-a-number"))
                .build();

        FeatureVector features = extractor.extract(request, 3);

        assertThat(features.get(0)).isEqualTo(0.5);
        assertThat(features.get(1)).isEqualTo(0.5);
        assertThat(features.get(7)).isCloseTo(650.0 / 850.0, within(1e-12));
        assertThat(features.get(9)).isEqualTo(0.5);
    }
}
