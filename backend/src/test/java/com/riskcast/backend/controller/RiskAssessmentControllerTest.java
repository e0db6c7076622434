package com.riskcast.backend.controller;

import com.riskcast.backend.exception.CircuitOpenException;
import com.riskcast.backend.exception.EngineTimeoutException;
import com.riskcast.backend.exception.GlobalExceptionHandler;
import com.riskcast.backend.exception.ModelInvocationException;
import com.riskcast.backend.exception.ResourceExhaustedException;
import com.riskcast.backend.exception.Stage;
import com.riskcast.backend.exception.ValidationInputException;
import com.riskcast.backend.model.CircuitBreakerState;
import com.riskcast.backend.model.ConfidenceSummary;
import com.riskcast.backend.model.EnsembleResult;
import com.riskcast.backend.model.HorizonResult;
import com.riskcast.backend.model.ModelUsed;
import com.riskcast.backend.model.RiskAssessmentRequest;
import com.riskcast.backend.service.engine.RiskEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RiskAssessmentControllerTest {

    private static final String BODY = """
            {"businessName": "Acme Logistics", "industry": "logistics",
             "country": "GB", "predictionHorizons": [3, 12], "modelType": "xgboost"}
            """;

    private final RiskEngine riskEngine = mock(RiskEngine.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskAssessmentController(riskEngine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsEnsembleResult() throws Exception {
        Map<Integer, HorizonResult> horizons = new LinkedHashMap<>();
        horizons.put(3, HorizonResult.success(3, 0.42, 0.87, ModelUsed.SHORT, Map.of("short", 1.0), false, null,
                null, List.of()));
        when(riskEngine.assess(any())).thenReturn(new EnsembleResult("risk:abc", horizons, false, 1L,
                new ConfidenceSummary(0.87, List.of(), List.of(3), 1.0), Instant.parse("2026-01-01T00:00:00Z")));

        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fingerprint").value("risk:abc"))
                .andExpect(jsonPath("$.horizons['3'].modelUsed").value("short"))
                .andExpect(jsonPath("$.horizons['3'].level").value("MEDIUM"))
                .andExpect(jsonPath("$.horizons['3'].errorCode").doesNotExist());

        ArgumentCaptor<RiskAssessmentRequest> captor = ArgumentCaptor.forClass(RiskAssessmentRequest.class);
        verify(riskEngine).assess(captor.capture());
        assertThat(captor.getValue().predictionHorizons()).containsExactly(3, 12);
        assertThat(captor.getValue().modelType().wireName()).isEqualTo("model_a");
    }

    @Test
    void mapsEngineErrorsToStatusCodes() throws Exception {
        when(riskEngine.assess(any())).thenThrow(new ValidationInputException("country must be a two-letter ISO code"));
        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_INPUT"))
                .andExpect(jsonPath("$.stage").value("VALIDATION"));

        when(riskEngine.assess(any())).thenThrow(new ResourceExhaustedException("Concurrency limit reached"));
        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_EXHAUSTED"));

        when(riskEngine.assess(any())).thenThrow(new EngineTimeoutException(Stage.ROUTER, "Prediction exceeded 500ms"));
        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.stage").value("ROUTER"));

        when(riskEngine.assess(any())).thenThrow(new ModelInvocationException("tree-short", "All horizons failed"));
        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("MODEL_INVOCATION"));
    }

    @Test
    void openBreakerAnswersRetryAfter() throws Exception {
        when(riskEngine.assess(any())).thenThrow(new CircuitOpenException("Model circuit breaker is open",
                Instant.now().plusSeconds(20)));

        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.errorCode").value("CIRCUIT_OPEN"))
                .andExpect(jsonPath("$.retryAfter").exists());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/risk/assess").contentType(MediaType.APPLICATION_JSON).content("{\"predictionHorizons\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_INPUT"));
    }

    @Test
    void reportsAndResetsBreaker() throws Exception {
        when(riskEngine.breakerState()).thenReturn(new CircuitBreakerState(CircuitBreakerState.State.CLOSED, 0, null,
                null, 5, Duration.ofSeconds(30), 3));

        mockMvc.perform(get("/api/v1/risk/breaker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"))
                .andExpect(jsonPath("$.failureThreshold").value(5));
        mockMvc.perform(post("/api/v1/risk/breaker/reset"))
                .andExpect(status().isOk());

        verify(riskEngine).resetBreaker();
    }
}
