package com.riskcast.backend.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.model.ValidationRun;
import com.riskcast.backend.repository.ValidationRunRepository;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class JpaValidationHistoryStore implements ValidationHistoryStore {

    private final ValidationRunRepository repository;
    private final ObjectMapper objectMapper;
    private final Retry retry;

    public JpaValidationHistoryStore(ValidationRunRepository repository, ObjectMapper objectMapper, Retry retry) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.retry = retry;
    }

    @Override
    public void append(ValidationResult result) {
        ValidationRun run = ValidationRun.builder()
                .runId(result.runId())
                .targetAchieved(result.targetAchieved())
                .folds(result.foldCount())
                .randomSeed(result.randomSeed())
                .sampleCount(result.sampleCount())
                .overallCalibrationError(result.calibration().calibrationError())
                .resultJson(writeJson(result))
                .createdAt(LocalDateTime.ofInstant(result.completedAt(), ZoneOffset.UTC))
                .build();
        Retry.decorateRunnable(retry, () -> repository.save(run)).run();
        log.debug("Stored validation run {}", result.runId());
    }

    @Override
    public List<ValidationResult> recent(int limit) {
        List<ValidationRun> runs = Retry.decorateSupplier(retry,
                () -> repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit))).get();
        List<ValidationResult> results = new ArrayList<>(runs.size());
        for (ValidationRun run : runs) {
            try {
                results.add(objectMapper.readValue(run.getResultJson(), ValidationResult.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable validation run {}: {}", run.getRunId(), e.getOriginalMessage());
            }
        }
        return results;
    }

    private String writeJson(ValidationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize validation run " + result.runId(), e);
        }
    }
}
