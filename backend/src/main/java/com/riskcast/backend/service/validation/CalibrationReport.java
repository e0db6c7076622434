package com.riskcast.backend.service.validation;

import java.util.List;

public record CalibrationReport(List<CalibrationBucket> buckets, double calibrationError) {
}
