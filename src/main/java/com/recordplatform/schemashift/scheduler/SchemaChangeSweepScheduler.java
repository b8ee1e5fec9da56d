package com.recordplatform.schemashift.scheduler;

import com.recordplatform.schemashift.dto.SweepResult;
import com.recordplatform.schemashift.service.orchestration.ChangeOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drains unprocessed schema change events across all organizations.
 * Off unless {@code schemashift.sweep.enabled} is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "schemashift.sweep.enabled", havingValue = "true")
public class SchemaChangeSweepScheduler {

    private final ChangeOrchestrator changeOrchestrator;

    @Scheduled(fixedDelayString = "${schemashift.sweep.fixed-delay-ms:60000}")
    public void sweepUnprocessedEvents() {
        log.debug("Running schema change sweep...");
        try {
            SweepResult result = changeOrchestrator.processUnprocessedEvents();
            if (result.getProcessed() > 0 || result.getFailed() > 0) {
                log.info("Schema change sweep completed: {} processed, {} failed",
                        result.getProcessed(), result.getFailed());
            }
        } catch (Exception e) {
            log.error("Schema change sweep failed: {}", e.getMessage(), e);
        }
    }
}
