package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.AdaptationOutcome;
import com.recordplatform.schemashift.dto.ConversionPreview;
import com.recordplatform.schemashift.dto.EventProcessingResult;
import com.recordplatform.schemashift.dto.EventProcessingResult.ConversionDecision;
import com.recordplatform.schemashift.dto.SchemaChangeImpactSummary;
import com.recordplatform.schemashift.dto.SeverityAssessment;
import com.recordplatform.schemashift.dto.SweepResult;
import com.recordplatform.schemashift.model.AffectedSystem;
import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.service.event.SchemaChangeEventStore;
import com.recordplatform.schemashift.service.severity.SeverityAssessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives a schema change event through its lifecycle:
 *
 * 0. measure real impact with the consumer validators, once per event
 * 1. assess severity and route notifications
 * 2. convert stored values for type changes
 * 3. fan out to every adapter concurrently
 * 4. mark the event processed
 *
 * Adapter failures are isolated per adapter and never prevent step 4. Every phase can be
 * re-run on the same event.
 */
@Service
@Slf4j
public class ChangeOrchestrator {

    private final SeverityAssessor severityAssessor;
    private final ChangeNotificationRouter notificationRouter;
    private final SchemaChangeEventStore eventStore;
    private final Map<AffectedSystemCategory, ConsumerImpactValidator> validators;
    private final List<SchemaChangeAdapter> adapters;
    private final Optional<TypeConversionEngine> conversionEngine;
    private final Executor adaptationExecutor;
    private final Clock clock;

    @Value("${schemashift.conversion.preview-sample-size:10}")
    private int previewSampleSize = 10;

    @Value("${schemashift.impact.window-days:30}")
    private int impactWindowDays = 30;

    @Value("${schemashift.impact.recent-events:10}")
    private int recentEventLimit = 10;

    public ChangeOrchestrator(SeverityAssessor severityAssessor,
                              ChangeNotificationRouter notificationRouter,
                              SchemaChangeEventStore eventStore,
                              List<ConsumerImpactValidator> validators,
                              List<SchemaChangeAdapter> adapters,
                              Optional<TypeConversionEngine> conversionEngine,
                              @Qualifier("schemaAdaptationExecutor") Executor adaptationExecutor,
                              Clock clock) {
        this.severityAssessor = severityAssessor;
        this.notificationRouter = notificationRouter;
        this.eventStore = eventStore;
        this.validators = validators.stream()
                .collect(Collectors.toMap(ConsumerImpactValidator::category, Function.identity(),
                        (first, second) -> first, () -> new EnumMap<>(AffectedSystemCategory.class)));
        this.adapters = List.copyOf(adapters);
        this.conversionEngine = conversionEngine;
        this.adaptationExecutor = adaptationExecutor;
        this.clock = clock;
    }

    // ========================= SINGLE EVENT =========================

    public EventProcessingResult processSchemaChangeEvent(SchemaChangeEvent event) {
        log.info("Processing schema change event {} ({}) for schema {}",
                event.getId(), event.getChangeType(), event.getSchemaId());

        measureImpact(event);

        SeverityAssessment assessment = severityAssessor.assessSeverity(event);
        notificationRouter.route(event, assessment);

        ConversionDecision conversionDecision = handleTypeConversion(event);

        List<AdaptationOutcome> outcomes = fanOut(event);

        boolean marked = eventStore.markProcessed(event.getOrganizationId(), event.getId());
        if (marked) {
            event.setProcessed(true);
        }

        EventProcessingResult result = EventProcessingResult.builder()
                .eventId(event.getId())
                .assessment(assessment)
                .conversionDecision(conversionDecision)
                .adapterOutcomes(outcomes)
                .markedProcessed(marked)
                .build();

        log.info("Event {} processed: severity={} adapters={} failed={}",
                event.getId(), assessment.getLevel().getLabel(), outcomes.size(), result.failedAdapterCount());
        return result;
    }

    // ========================= SWEEPS =========================

    public SweepResult processUnprocessedEvents() {
        return sweep(eventStore.queryAllUnprocessed());
    }

    public SweepResult processUnprocessedEvents(String organizationId, String schemaId) {
        return sweep(eventStore.queryUnprocessed(organizationId, schemaId));
    }

    private SweepResult sweep(List<SchemaChangeEvent> events) {
        int processed = 0;
        int failed = 0;
        for (SchemaChangeEvent event : events) {
            try {
                processSchemaChangeEvent(event);
                processed++;
            } catch (Exception e) {
                failed++;
                log.error("Failed to process schema change event {}: {}", event.getId(), e.getMessage(), e);
            }
        }
        if (!events.isEmpty()) {
            log.debug("Schema change sweep finished: {} processed, {} failed", processed, failed);
        }
        return SweepResult.builder()
                .processed(processed)
                .failed(failed)
                .build();
    }

    // ========================= IMPACT SUMMARY =========================

    public SchemaChangeImpactSummary getSchemaChangeImpactSummary(String organizationId, String schemaId) {
        LocalDateTime windowStart = LocalDateTime.now(clock).minusDays(impactWindowDays);
        List<SchemaChangeEvent> events = eventStore.findSince(organizationId, schemaId, windowStart);

        Map<SchemaChangeType, Long> byType = new EnumMap<>(SchemaChangeType.class);
        Map<AffectedSystemCategory, Integer> bySystem = new EnumMap<>(AffectedSystemCategory.class);
        int unprocessed = 0;

        for (SchemaChangeEvent event : events) {
            byType.merge(event.getChangeType(), 1L, Long::sum);
            if (event.getAffectedSystems() != null) {
                for (AffectedSystem affected : event.getAffectedSystems()) {
                    bySystem.merge(affected.getSystem(), affected.getItemsAffected(), Integer::sum);
                }
            }
            if (!event.isProcessed()) {
                unprocessed++;
            }
        }

        List<SchemaChangeEvent> recent = events.stream()
                .sorted((a, b) -> b.getTimestamp().compareTo(a.getTimestamp()))
                .limit(recentEventLimit)
                .toList();

        return SchemaChangeImpactSummary.builder()
                .schemaId(schemaId)
                .windowStart(windowStart)
                .totalEvents(events.size())
                .unprocessedEvents(unprocessed)
                .eventsByChangeType(byType)
                .itemsAffectedBySystem(bySystem)
                .recentEvents(new ArrayList<>(recent))
                .build();
    }

    // ========================= PHASES =========================

    private void measureImpact(SchemaChangeEvent event) {
        if (event.getAffectedSystems() == null || event.getAffectedSystems().isEmpty()) {
            return;
        }
        // Adapters rewrite the bindings they count, so a replay would measure zero
        if (event.getImpactMeasuredAt() != null || event.isProcessed()) {
            log.debug("Event {} already measured, assessing from recorded counts", event.getId());
            return;
        }
        boolean measured = false;
        for (AffectedSystem affected : event.getAffectedSystems()) {
            ConsumerImpactValidator validator = validators.get(affected.getSystem());
            if (validator == null) {
                continue;
            }
            try {
                affected.setItemsAffected(validator.countAffectedItems(event));
                measured = true;
            } catch (Exception e) {
                log.warn("Impact measurement for {} failed on event {}, keeping prediction: {}",
                        affected.getSystem(), event.getId(), e.getMessage());
            }
        }
        if (measured) {
            event.setImpactMeasuredAt(LocalDateTime.now(clock));
            try {
                eventStore.recordMeasuredImpact(event);
            } catch (Exception e) {
                log.warn("Could not persist measured impact for event {}: {}", event.getId(), e.getMessage());
            }
        }
    }

    private ConversionDecision handleTypeConversion(SchemaChangeEvent event) {
        if (event.getChangeType() != SchemaChangeType.FIELD_TYPE_CHANGED) {
            return ConversionDecision.NOT_APPLICABLE;
        }
        if (conversionEngine.isEmpty()) {
            log.debug("No type conversion engine configured, leaving values of field {} as they are",
                    event.getFieldId());
            return ConversionDecision.SKIPPED_NO_ENGINE;
        }

        TypeConversionEngine engine = conversionEngine.get();
        String fieldKey = event.currentFieldReference();
        try {
            if (engine.isSafeConversion(event.getOldFieldType(), event.getNewFieldType())) {
                engine.convertFieldType(event.getSchemaId(), fieldKey, event.getOldFieldType(), event.getNewFieldType());
                log.info("Converted field {} of schema {} from {} to {}",
                        fieldKey, event.getSchemaId(), event.getOldFieldType(), event.getNewFieldType());
                return ConversionDecision.AUTO_CONVERTED;
            }
            ConversionPreview preview = engine.generateConversionPreview(event.getSchemaId(), fieldKey,
                    event.getOldFieldType(), event.getNewFieldType(), previewSampleSize);
            engine.createConversionApprovalRequest(event, preview);
            log.info("Conversion of field {} from {} to {} awaits approval ({} of {} sampled values failed)",
                    fieldKey, event.getOldFieldType(), event.getNewFieldType(),
                    preview.getFailedConversions(), preview.getSampledRecords());
            return ConversionDecision.APPROVAL_REQUESTED;
        } catch (Exception e) {
            log.error("Type conversion failed for event {}: {}", event.getId(), e.getMessage(), e);
            return ConversionDecision.FAILED;
        }
    }

    private List<AdaptationOutcome> fanOut(SchemaChangeEvent event) {
        List<CompletableFuture<AdaptationOutcome>> futures = adapters.stream()
                .map(adapter -> submit(adapter, event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private CompletableFuture<AdaptationOutcome> submit(SchemaChangeAdapter adapter, SchemaChangeEvent event) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> {
                        adapter.adapt(event);
                        return AdaptationOutcome.success(adapter.name());
                    }, adaptationExecutor)
                    .exceptionally(ex -> adapterFailed(adapter, event, ex));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(adapterFailed(adapter, event, e));
        }
    }

    private AdaptationOutcome adapterFailed(SchemaChangeAdapter adapter, SchemaChangeEvent event, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.error("Adapter {} failed for event {}: {}", adapter.name(), event.getId(), cause.getMessage(), cause);
        return AdaptationOutcome.failure(adapter.name(), cause.getMessage());
    }
}
