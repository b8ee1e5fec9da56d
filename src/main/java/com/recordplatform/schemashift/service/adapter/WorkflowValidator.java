package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.dto.WorkflowValidationResult;
import com.recordplatform.schemashift.dto.resolver.ResolvedField;
import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaField;
import com.recordplatform.schemashift.model.Workflow;
import com.recordplatform.schemashift.repository.SchemaRepository;
import com.recordplatform.schemashift.repository.WorkflowRepository;
import com.recordplatform.schemashift.service.orchestration.ConsumerImpactValidator;
import com.recordplatform.schemashift.service.orchestration.NotificationSink;
import com.recordplatform.schemashift.service.resolver.CachedFieldResolver;
import com.recordplatform.schemashift.service.resolver.FieldResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks stored workflows against the current shape of their trigger schema.
 *
 * Each trigger field reference and each action mapping source is resolved with common
 * aliases. A reference that does not resolve is an error and invalidates the workflow; one
 * that resolves below {@link FieldResolver#VALID_CONFIDENCE} is a warning.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkflowValidator implements ConsumerImpactValidator {

    private final WorkflowRepository workflowRepository;
    private final SchemaRepository schemaRepository;
    private final CachedFieldResolver cachedFieldResolver;
    private final FieldResolver fieldResolver;
    private final NotificationSink notificationSink;
    private final Clock clock;

    @Override
    public AffectedSystemCategory category() {
        return AffectedSystemCategory.WORKFLOWS;
    }

    public WorkflowValidationResult validateWorkflow(Workflow workflow, Schema schema) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (workflow.referencesSchema(schema.getId())) {
            for (String reference : workflow.fieldReferences()) {
                Optional<ResolvedField> resolved = cachedFieldResolver.resolve(schema, reference);
                if (resolved.isEmpty()) {
                    errors.add("Field '" + reference + "' not found in schema '" + schema.getName() + "'");
                } else if (resolved.get().getConfidence() < FieldResolver.VALID_CONFIDENCE) {
                    warnings.add("Field '" + reference + "' loosely matched '" + resolved.get().getFieldLabel()
                            + "' (" + resolved.get().getMatchType().getWireName() + ", confidence "
                            + resolved.get().getConfidence() + ")");
                }
            }
        }

        return WorkflowValidationResult.builder()
                .workflowId(workflow.getId())
                .workflowName(workflow.getName())
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    /**
     * Revalidate every active workflow of the event's workspace that triggers on the changed
     * schema, store the outcome on the workflow and raise one advisory per workflow with warnings.
     */
    public List<WorkflowValidationResult> validateWorkflowsForSchema(SchemaChangeEvent event) {
        Optional<Schema> schema = schemaRepository.findByIdAndOrganizationId(
                event.getSchemaId(), event.getOrganizationId());
        if (schema.isEmpty()) {
            log.warn("Schema {} not found, skipping workflow validation for event {}",
                    event.getSchemaId(), event.getId());
            return List.of();
        }

        List<WorkflowValidationResult> results = new ArrayList<>();
        for (Workflow workflow : activeWorkflowsFor(event)) {
            WorkflowValidationResult result = validateWorkflow(workflow, schema.get());
            results.add(result);

            workflow.setValidationErrors(new ArrayList<>(result.getErrors()));
            workflow.setValidationWarnings(new ArrayList<>(result.getWarnings()));
            workflow.setLastValidatedAt(LocalDateTime.now(clock));
            workflowRepository.save(workflow);

            if (!result.isValid()) {
                log.warn("Workflow '{}' ({}) has {} broken field reference(s) after event {}",
                        workflow.getName(), workflow.getId(), result.getErrors().size(), event.getId());
            }
            if (result.hasWarnings()) {
                raiseAdvisory(event, result);
            }
        }

        log.info("Validated {} workflow(s) against schema {} for event {}",
                results.size(), event.getSchemaId(), event.getId());
        return results;
    }

    /**
     * Number of active workflows that reference the changed field by its previous identity.
     */
    @Override
    public int countAffectedItems(SchemaChangeEvent event) {
        String previous = event.previousFieldReference();
        if (!event.getChangeType().isFieldLevel() || previous == null) {
            return 0;
        }
        Schema previousField = previousFieldSnapshot(event);

        int count = 0;
        for (Workflow workflow : activeWorkflowsFor(event)) {
            boolean affected = workflow.fieldReferences().stream()
                    .map(ref -> fieldResolver.resolveField(previousField, ref))
                    .anyMatch(r -> r.isPresent() && r.get().getConfidence() >= FieldResolver.VALID_CONFIDENCE);
            if (affected) {
                count++;
            }
        }
        return count;
    }

    private List<Workflow> activeWorkflowsFor(SchemaChangeEvent event) {
        return workflowRepository.findByOrganizationIdAndWorkspaceIdAndStatus(
                        event.getOrganizationId(), event.getWorkspaceId(), Workflow.Status.ACTIVE)
                .stream()
                .filter(w -> w.referencesSchema(event.getSchemaId()))
                .toList();
    }

    // Single-field schema holding the field as it was before the change
    private Schema previousFieldSnapshot(SchemaChangeEvent event) {
        SchemaField field = SchemaField.builder()
                .id(event.getFieldId())
                .key(event.getOldFieldKey())
                .label(event.getOldFieldName())
                .type(event.getOldFieldType())
                .build();
        return Schema.builder()
                .id(event.getSchemaId())
                .fields(new ArrayList<>(List.of(field)))
                .build();
    }

    private void raiseAdvisory(SchemaChangeEvent event, WorkflowValidationResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.getId());
        metadata.put("workflowId", result.getWorkflowId());
        metadata.put("warnings", result.getWarnings());

        ChangeNotification advisory = ChangeNotification.builder()
                .organizationId(event.getOrganizationId())
                .title("Review workflow '" + result.getWorkflowName() + "'")
                .message(result.getWarnings().size() + " field reference(s) matched only loosely after a schema change.")
                .type(ChangeNotification.Type.WORKFLOW_ADVISORY)
                .severity("medium")
                .blocking(false)
                .deliveryKey(event.getId() + ":" + result.getWorkflowId())
                .actions(List.of(ChangeNotification.Action.REVIEW_WORKFLOW))
                .metadata(metadata)
                .build();
        try {
            notificationSink.notify(advisory);
        } catch (Exception e) {
            log.error("Failed to raise advisory for workflow {}: {}", result.getWorkflowId(), e.getMessage(), e);
        }
    }
}
