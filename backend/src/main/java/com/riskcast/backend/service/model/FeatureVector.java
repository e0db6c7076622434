package com.riskcast.backend.service.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-order model input. The order of {@link #NAMES} is part of the artifact contract: both model
 * artifacts index into this vector by position.
 */
public final class FeatureVector {

    public static final List<String> NAMES = List.of(
            "industry_risk",
            "country_risk",
            "business_age",
            "revenue_growth",
            "profit_margin",
            "debt_to_equity",
            "cash_flow",
            "credit_score",
            "market_volatility",
            "contact_completeness",
            "employee_scale",
            "horizon"
    );

    public static final int SIZE = NAMES.size();
    public static final int HORIZON_INDEX = NAMES.indexOf("horizon");
    public static final double MAX_HORIZON_MONTHS = 24.0;

    private final double[] values;

    public FeatureVector(double[] values) {
        if (values.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " features but got " + values.length);
        }
        this.values = values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public int horizonMonths() {
        return (int) Math.round(values[HORIZON_INDEX] * MAX_HORIZON_MONTHS);
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
