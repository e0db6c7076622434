package com.riskcast.backend.service.model;

public record ModelOutput(double score, double confidence) {
}
