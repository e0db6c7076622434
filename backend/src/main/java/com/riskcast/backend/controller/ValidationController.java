package com.riskcast.backend.controller;

import com.riskcast.backend.service.validation.ValidationHarness;
import com.riskcast.backend.service.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/validation")
@RequiredArgsConstructor
public class ValidationController {

    private final ValidationHarness validationHarness;

    /**
     * Runs cross-validation over the synthetic dataset. With {@code enforce=true} a missed target answers
     * 422 after the run has been recorded.
     */
    @PostMapping("/run")
    public ValidationResult run(@RequestParam(defaultValue = "false") boolean applyWeights,
                                @RequestParam(defaultValue = "false") boolean enforce) {
        ValidationResult result = validationHarness.validateSynthetic();
        if (applyWeights) {
            validationHarness.applyRecommendedWeights(result);
        }
        if (enforce) {
            validationHarness.requireTargets(result);
        }
        return result;
    }

    @GetMapping("/history")
    public List<ValidationResult> history(@RequestParam(defaultValue = "20") int limit) {
        return validationHarness.history(Math.max(1, Math.min(limit, 200)));
    }
}
