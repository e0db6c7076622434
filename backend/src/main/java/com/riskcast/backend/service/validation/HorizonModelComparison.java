package com.riskcast.backend.service.validation;

/**
 * Held-out comparison of the blended ensemble against each single model for one horizon. Positive
 * improvements mean the ensemble has the lower error.
 */
public record HorizonModelComparison(
        int horizon,
        double shortMae,
        double longMae,
        double ensembleMae,
        double shortAccuracy,
        double longAccuracy,
        double ensembleAccuracy,
        double maeImprovementOverShort,
        double maeImprovementOverLong,
        boolean ensembleBeatsShort,
        boolean ensembleBeatsLong,
        double recommendedShortWeight,
        double recommendedLongWeight
) {
}
