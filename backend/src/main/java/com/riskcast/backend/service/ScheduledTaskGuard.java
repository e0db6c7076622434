package com.riskcast.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    /**
     * Runs a background task so that a failure is logged and counted but never kills the schedule.
     */
    public boolean run(String taskName, Runnable task) {
        MDC.put("requestId", taskName + "-" + UUID.randomUUID());
        try {
            task.run();
            return true;
        } catch (Exception e) {
            log.error("Scheduled task failed task={}", taskName, e);
            metricsService.recordBackgroundTaskFailure(taskName);
            return false;
        } finally {
            MDC.remove("requestId");
        }
    }
}
