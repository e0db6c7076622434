package com.riskcast.backend.controller;

import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.engine.RiskEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
public class RiskAssessmentController {

    private final RiskEngine riskEngine;

    @PostMapping("/assess")
    public EnsembleResult assess(@RequestBody RiskAssessmentRequest request) {
        return riskEngine.assess(request);
    }

    @GetMapping("/breaker")
    public CircuitBreakerState breaker() {
        return riskEngine.breakerState();
    }

    @PostMapping("/breaker/reset")
    public ResponseEntity<CircuitBreakerState> resetBreaker() {
        riskEngine.resetBreaker();
        return ResponseEntity.ok(riskEngine.breakerState());
    }
}
