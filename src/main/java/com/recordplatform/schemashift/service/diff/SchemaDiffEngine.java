package com.recordplatform.schemashift.service.diff;

import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.model.SchemaField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Computes the atomic changes between two snapshots of the same schema.
 *
 * Fields are joined by their immutable id, never by key, so a field deleted and a new
 * field added under the same key come out as a delete and an add rather than a rename.
 * Label, key and type are compared independently: a field edited on all three axes
 * yields three sibling events.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaDiffEngine {

    private final ImpactPredictor impactPredictor;
    private final Clock clock;

    public List<SchemaChangeEvent> detectChanges(Schema oldSchema, Schema newSchema, String organizationId) {
        List<SchemaChangeEvent> events = new ArrayList<>();

        if (!Objects.equals(oldSchema.getName(), newSchema.getName())) {
            events.add(newEvent(newSchema, organizationId, SchemaChangeType.SCHEMA_RENAMED)
                    .oldSchemaName(oldSchema.getName())
                    .newSchemaName(newSchema.getName())
                    .build());
        }

        diffFields(oldSchema, newSchema, organizationId, events);

        events.forEach(e -> e.setAffectedSystems(impactPredictor.predict(e)));

        log.info("Schema {} diff: {} change event(s)", newSchema.getId(), events.size());
        return events;
    }

    // ========================= FIELD DIFF =========================

    private void diffFields(Schema oldSchema, Schema newSchema, String organizationId,
                            List<SchemaChangeEvent> events) {
        Map<String, SchemaField> oldFields = buildFieldMap(oldSchema);
        Map<String, SchemaField> newFields = buildFieldMap(newSchema);

        for (SchemaField oldField : oldFields.values()) {
            if (!newFields.containsKey(oldField.getId())) {
                events.add(newEvent(newSchema, organizationId, SchemaChangeType.FIELD_DELETED)
                        .fieldId(oldField.getId())
                        .oldFieldName(oldField.getLabel())
                        .oldFieldKey(oldField.getKey())
                        .oldFieldType(oldField.getType())
                        .build());
            }
        }

        for (SchemaField newField : newFields.values()) {
            SchemaField oldField = oldFields.get(newField.getId());
            if (oldField == null) {
                events.add(newEvent(newSchema, organizationId, SchemaChangeType.FIELD_ADDED)
                        .fieldId(newField.getId())
                        .newFieldName(newField.getLabel())
                        .newFieldKey(newField.getKey())
                        .newFieldType(newField.getType())
                        .build());
                continue;
            }

            if (!Objects.equals(oldField.getLabel(), newField.getLabel())) {
                events.add(modifiedFieldEvent(newSchema, organizationId, SchemaChangeType.FIELD_RENAMED,
                        oldField, newField));
            }
            // Separate from the label rename: key changes break consumers that store keys
            if (!Objects.equals(oldField.getKey(), newField.getKey())) {
                events.add(modifiedFieldEvent(newSchema, organizationId, SchemaChangeType.FIELD_KEY_CHANGED,
                        oldField, newField));
            }
            if (oldField.getType() != newField.getType()) {
                SchemaChangeEvent typeChange = modifiedFieldEvent(newSchema, organizationId,
                        SchemaChangeType.FIELD_TYPE_CHANGED, oldField, newField);
                typeChange.setOldFieldType(oldField.getType());
                typeChange.setNewFieldType(newField.getType());
                events.add(typeChange);
            }
        }
    }

    private Map<String, SchemaField> buildFieldMap(Schema schema) {
        Map<String, SchemaField> fields = new LinkedHashMap<>();
        if (schema.getFields() != null) {
            for (SchemaField field : schema.getFields()) {
                fields.putIfAbsent(field.getId(), field);
            }
        }
        return fields;
    }

    private SchemaChangeEvent modifiedFieldEvent(Schema schema, String organizationId, SchemaChangeType type,
                                                 SchemaField oldField, SchemaField newField) {
        return newEvent(schema, organizationId, type)
                .fieldId(newField.getId())
                .oldFieldName(oldField.getLabel())
                .newFieldName(newField.getLabel())
                .oldFieldKey(oldField.getKey())
                .newFieldKey(newField.getKey())
                .build();
    }

    private SchemaChangeEvent.SchemaChangeEventBuilder newEvent(Schema schema, String organizationId,
                                                                SchemaChangeType type) {
        LocalDateTime now = LocalDateTime.now(clock);
        return SchemaChangeEvent.builder()
                .id("sce_" + UUID.randomUUID())
                .organizationId(organizationId)
                .workspaceId(schema.getWorkspaceId())
                .schemaId(schema.getId())
                .changeType(type)
                .timestamp(now)
                .createdAt(now)
                .processed(false);
    }
}
