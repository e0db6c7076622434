package com.riskcast.backend.service.validation;

import java.util.List;

/**
 * Append-only record of validation runs.
 */
public interface ValidationHistoryStore {

    void append(ValidationResult result);

    /**
     * Most recent runs first.
     */
    List<ValidationResult> recent(int limit);
}
