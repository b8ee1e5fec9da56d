package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.TestFixtures;
import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.dto.WorkflowValidationResult;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.model.Workflow;
import com.recordplatform.schemashift.repository.SchemaRepository;
import com.recordplatform.schemashift.repository.WorkflowRepository;
import com.recordplatform.schemashift.service.orchestration.NotificationSink;
import com.recordplatform.schemashift.service.resolver.CachedFieldResolver;
import com.recordplatform.schemashift.service.resolver.FieldResolver;
import com.recordplatform.schemashift.service.resolver.ResolverCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private WorkflowRepository workflowRepository;

    @Mock
    private SchemaRepository schemaRepository;

    @Mock
    private NotificationSink notificationSink;

    private WorkflowValidator validator;
    private Schema schema;

    @BeforeEach
    void setUp() {
        FieldResolver fieldResolver = new FieldResolver();
        CachedFieldResolver cachedResolver =
                new CachedFieldResolver(fieldResolver, new ResolverCache(Duration.ofMinutes(5), CLOCK));
        validator = new WorkflowValidator(workflowRepository, schemaRepository, cachedResolver,
                fieldResolver, notificationSink, CLOCK);
        schema = TestFixtures.contactSchema();
    }

    @Test
    void unresolvedReferenceIsAnErrorAndLooseMatchIsAWarning() {
        Workflow workflow = workflow("wf-1", "schema-contacts", List.of("Contact Email"), Map.of(
                "to", "email",
                "name", "fullName",
                "budget", "deal",
                "carrier", "shipping_carrier"));

        WorkflowValidationResult result = validator.validateWorkflow(workflow, schema);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).contains("shipping_carrier");
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("'deal'");
    }

    @Test
    void workflowOnAnotherSchemaIsNotChecked() {
        Workflow workflow = workflow("wf-1", "schema-orders", List.of("shipping_carrier"), Map.of());

        WorkflowValidationResult result = validator.validateWorkflow(workflow, schema);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void validatesActiveWorkflowsAndRaisesOneAdvisoryPerWarnedWorkflow() {
        Workflow warned = workflow("wf-warn", "schema-contacts", List.of("deal", "phon"), Map.of());
        Workflow clean = workflow("wf-ok", "schema-contacts", List.of("phone"), Map.of("to", "email"));
        Workflow elsewhere = workflow("wf-other", "schema-orders", List.of("sku"), Map.of());
        when(schemaRepository.findByIdAndOrganizationId("schema-contacts", "org-1")).thenReturn(Optional.of(schema));
        when(workflowRepository.findByOrganizationIdAndWorkspaceIdAndStatus("org-1", "ws-1", Workflow.Status.ACTIVE))
                .thenReturn(List.of(warned, clean, elsewhere));

        List<WorkflowValidationResult> results = validator.validateWorkflowsForSchema(keyChange());

        assertThat(results).extracting(WorkflowValidationResult::getWorkflowId).containsExactly("wf-warn", "wf-ok");
        verify(workflowRepository, times(2)).save(any(Workflow.class));
        assertThat(warned.getValidationWarnings()).hasSize(2);
        assertThat(warned.getLastValidatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        assertThat(clean.getValidationWarnings()).isEmpty();

        ArgumentCaptor<ChangeNotification> advisory = ArgumentCaptor.forClass(ChangeNotification.class);
        verify(notificationSink).notify(advisory.capture());
        assertThat(advisory.getValue().getType()).isEqualTo(ChangeNotification.Type.WORKFLOW_ADVISORY);
        assertThat(advisory.getValue().getMetadata()).containsEntry("workflowId", "wf-warn");
        assertThat(advisory.getValue().getDeliveryKey()).isEqualTo("sce_1:wf-warn");
    }

    @Test
    void missingSchemaSkipsValidation() {
        when(schemaRepository.findByIdAndOrganizationId("schema-contacts", "org-1")).thenReturn(Optional.empty());

        assertThat(validator.validateWorkflowsForSchema(keyChange())).isEmpty();
        verify(workflowRepository, never()).save(any());
    }

    @Test
    void countsWorkflowsReferencingThePreviousIdentity() {
        when(workflowRepository.findByOrganizationIdAndWorkspaceIdAndStatus("org-1", "ws-1", Workflow.Status.ACTIVE))
                .thenReturn(List.of(
                        workflow("wf-key", "schema-contacts", List.of("email"), Map.of()),
                        workflow("wf-label", "schema-contacts", List.of(), Map.of("to", "Email")),
                        workflow("wf-fuzzy", "schema-contacts", List.of("mail"), Map.of()),
                        workflow("wf-unrelated", "schema-contacts", List.of("phone"), Map.of()),
                        workflow("wf-other", "schema-orders", List.of("email"), Map.of())));

        assertThat(validator.countAffectedItems(keyChange())).isEqualTo(2);
    }

    @Test
    void addedFieldAffectsNothing() {
        SchemaChangeEvent added = SchemaChangeEvent.builder()
                .organizationId("org-1").workspaceId("ws-1").schemaId("schema-contacts")
                .changeType(SchemaChangeType.FIELD_ADDED)
                .newFieldKey("twitter")
                .build();

        assertThat(validator.countAffectedItems(added)).isZero();
    }

    private static SchemaChangeEvent keyChange() {
        return SchemaChangeEvent.builder()
                .id("sce_1")
                .organizationId("org-1")
                .workspaceId("ws-1")
                .schemaId("schema-contacts")
                .changeType(SchemaChangeType.FIELD_KEY_CHANGED)
                .fieldId("f2")
                .oldFieldName("Email").newFieldName("Contact Email")
                .oldFieldKey("email").newFieldKey("contact_email")
                .oldFieldType(FieldType.EMAIL)
                .build();
    }

    private static Workflow workflow(String id, String schemaId, List<String> triggerRefs, Map<String, String> mappings) {
        return Workflow.builder()
                .id(id)
                .organizationId("org-1")
                .workspaceId("ws-1")
                .name("Workflow " + id)
                .status(Workflow.Status.ACTIVE)
                .trigger(Workflow.Trigger.builder()
                        .type("entity.updated")
                        .schemaId(schemaId)
                        .fieldReferences(new ArrayList<>(triggerRefs))
                        .build())
                .actions(new ArrayList<>(List.of(Workflow.Action.builder()
                        .id(id + "-a1")
                        .type("send_email")
                        .fieldMappings(new LinkedHashMap<>(mappings))
                        .build())))
                .build();
    }
}
