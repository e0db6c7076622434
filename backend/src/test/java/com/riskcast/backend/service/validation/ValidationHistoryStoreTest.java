package com.riskcast.backend.service.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.config.ResilienceConfig;
import com.riskcast.backend.model.ValidationRun;
import com.riskcast.backend.repository.ValidationRunRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidationHistoryStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void inMemoryStoreKeepsMostRecentRuns() {
        InMemoryValidationHistoryStore store = new InMemoryValidationHistoryStore(2);
        store.append(result("run-1"));
        store.append(result("run-2"));
        store.append(result("run-3"));

        assertThat(store.recent(10)).extracting(ValidationResult::runId).containsExactly("run-3", "run-2");
        assertThat(store.recent(1)).extracting(ValidationResult::runId).containsExactly("run-3");
    }

    @Test
    void jpaStoreRetriesTransientFailuresAndRoundTripsJson() {
        ValidationRunRepository repository = mock(ValidationRunRepository.class);
        when(repository.save(any(ValidationRun.class)))
                .thenThrow(new QueryTimeoutException("statement timeout"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        JpaValidationHistoryStore store = new JpaValidationHistoryStore(repository, objectMapper,
                new ResilienceConfig().historyStoreRetry(3, 1, 0.2));

        ValidationResult original = result("run-1");
        store.append(original);

        ArgumentCaptor<ValidationRun> saved = ArgumentCaptor.forClass(ValidationRun.class);
        verify(repository, times(2)).save(saved.capture());
        ValidationRun run = saved.getValue();
        assertThat(run.getRunId()).isEqualTo("run-1");
        assertThat(run.isTargetAchieved()).isTrue();
        assertThat(run.getFolds()).isEqualTo(5);

        ValidationRun unreadable = ValidationRun.builder().runId("broken").resultJson("{not json").build();
        when(repository.findAllByOrderByCreatedAtDesc(any())).thenReturn(List.of(run, unreadable));

        assertThat(store.recent(5)).containsExactly(original);
    }

    private static ValidationResult result(String runId) {
        HorizonMetrics metrics = new HorizonMetrics(6, 100, 0.9, 0.05, 0.07, 0.6, 0.85, 0.03);
        CalibrationReport calibration = new CalibrationReport(List.of(
                new CalibrationBucket("low", 0.0, 0.7, 20, 0.6, 0.65),
                new CalibrationBucket("high", 0.7, 1.0, 80, 0.9, 0.92)), 0.026);
        return new ValidationResult(runId, Instant.parse("2026-04-01T00:00:00Z"), 5, 42L, 100, Map.of(6, metrics),
                calibration, List.of(new FoldResult(0, 80, 20, Map.of(6, 0.5), Map.of(6, metrics))), Map.of(),
                List.of(), true, List.of());
    }
}
