package com.riskcast.backend.dto;

public record InvalidationResponse(String pattern, String tag, long removed) {
}
