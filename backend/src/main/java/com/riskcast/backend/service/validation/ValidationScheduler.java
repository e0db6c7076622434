package com.riskcast.backend.service.validation;

import com.riskcast.backend.config.ValidationProperties;
import com.riskcast.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationScheduler {

    private final ValidationHarness validationHarness;
    private final ValidationProperties validationProperties;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${riskcast.validation.schedule.interval-ms:21600000}",
            initialDelayString = "${riskcast.validation.schedule.interval-ms:21600000}")
    public void scheduledValidation() {
        if (!validationProperties.getSchedule().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run("periodic-validation", this::runValidation);
    }

    void runValidation() {
        ValidationResult result = validationHarness.validateSynthetic();
        if (!result.targetAchieved()) {
            log.warn("Periodic validation {} missed targets {}; top recommendation: {}", result.runId(),
                    result.failedTargets(),
                    result.recommendations().isEmpty() ? "none" : result.recommendations().get(0).action());
        }
        if (validationProperties.getSchedule().isApplyRecommendedWeights()) {
            validationHarness.applyRecommendedWeights(result);
        }
    }
}
