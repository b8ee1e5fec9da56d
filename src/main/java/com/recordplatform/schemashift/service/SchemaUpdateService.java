package com.recordplatform.schemashift.service;

import com.recordplatform.schemashift.exception.SchemaNotFoundException;
import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.model.SchemaField;
import com.recordplatform.schemashift.repository.SchemaRepository;
import com.recordplatform.schemashift.service.event.SchemaChangePublisher;
import com.recordplatform.schemashift.service.resolver.CachedFieldResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for saving a schema snapshot. Every save of an existing schema is diffed
 * against the stored snapshot and the changes are published before the new snapshot
 * replaces it.
 *
 * The field-level edits load the stored snapshot, apply one change to a copy and go
 * through {@link #updateSchema(String, Schema)} like any other save.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaUpdateService {

    private final SchemaRepository schemaRepository;
    private final SchemaChangePublisher changePublisher;
    private final CachedFieldResolver cachedFieldResolver;
    private final Clock clock;

    public Schema updateSchema(String organizationId, Schema schema) {
        Optional<Schema> stored = schema.getId() == null
                ? Optional.empty()
                : schemaRepository.findByIdAndOrganizationId(schema.getId(), organizationId);

        Schema toSave = schema.toBuilder()
                .organizationId(organizationId)
                .updatedAt(LocalDateTime.now(clock))
                .build();

        if (stored.isEmpty()) {
            log.info("Creating schema '{}' in organization {}", schema.getName(), organizationId);
            toSave.setVersion(Math.max(schema.getVersion(), 1));
            return schemaRepository.save(toSave);
        }

        Schema previous = stored.get();
        List<SchemaChangeEvent> events = changePublisher.publishChanges(previous, toSave, organizationId);

        boolean fieldsChanged = events.stream()
                .anyMatch(e -> e.getChangeType() != SchemaChangeType.SCHEMA_RENAMED);
        toSave.setVersion(fieldsChanged ? previous.getVersion() + 1 : previous.getVersion());

        Schema saved = schemaRepository.save(toSave);
        cachedFieldResolver.evictSchema(saved.getId());

        log.info("Schema {} saved at version {} with {} change event(s)",
                saved.getId(), saved.getVersion(), events.size());
        return saved;
    }

    // ========================= FIELD EDITS =========================

    public SchemaField addField(String organizationId, String schemaId, SchemaField field) {
        Schema schema = load(organizationId, schemaId);
        boolean keyTaken = schema.getFields().stream().anyMatch(f -> f.getKey().equals(field.getKey()));
        if (keyTaken) {
            throw new IllegalArgumentException("Field key '" + field.getKey() + "' already exists in schema " + schemaId);
        }

        SchemaField added = copy(field);
        added.setId("field_" + field.getKey() + "_" + clock.millis());

        List<SchemaField> fields = copyFields(schema);
        fields.add(added);
        updateSchema(organizationId, schema.toBuilder().fields(fields).build());
        return added;
    }

    /**
     * Applies the non-null key, label, type and options of {@code changes} to the field.
     */
    public SchemaField updateField(String organizationId, String schemaId, String fieldId, SchemaField changes) {
        Schema schema = load(organizationId, schemaId);
        List<SchemaField> fields = copyFields(schema);
        SchemaField field = fields.stream()
                .filter(f -> fieldId.equals(f.getId()))
                .findFirst()
                .orElseThrow(() -> fieldNotFound(schemaId, fieldId));

        if (changes.getKey() != null) field.setKey(changes.getKey());
        if (changes.getLabel() != null) field.setLabel(changes.getLabel());
        if (changes.getType() != null) field.setType(changes.getType());
        if (changes.getOptions() != null) field.setOptions(new ArrayList<>(changes.getOptions()));

        updateSchema(organizationId, schema.toBuilder().fields(fields).build());
        return field;
    }

    public void removeField(String organizationId, String schemaId, String fieldId) {
        Schema schema = load(organizationId, schemaId);
        List<SchemaField> fields = copyFields(schema);
        if (!fields.removeIf(f -> fieldId.equals(f.getId()))) {
            throw fieldNotFound(schemaId, fieldId);
        }
        updateSchema(organizationId, schema.toBuilder().fields(fields).build());
    }

    private Schema load(String organizationId, String schemaId) {
        return schemaRepository.findByIdAndOrganizationId(schemaId, organizationId)
                .orElseThrow(() -> new SchemaNotFoundException(schemaId, organizationId));
    }

    // The stored snapshot is the diff baseline, so edits work on copies
    private static List<SchemaField> copyFields(Schema schema) {
        List<SchemaField> fields = new ArrayList<>();
        for (SchemaField field : schema.getFields()) {
            fields.add(copy(field));
        }
        return fields;
    }

    private static SchemaField copy(SchemaField field) {
        return SchemaField.builder()
                .id(field.getId())
                .key(field.getKey())
                .label(field.getLabel())
                .type(field.getType())
                .hidden(field.isHidden())
                .options(field.getOptions() == null ? null : new ArrayList<>(field.getOptions()))
                .config(field.getConfig() == null ? null : new HashMap<>(field.getConfig()))
                .build();
    }

    private static IllegalArgumentException fieldNotFound(String schemaId, String fieldId) {
        return new IllegalArgumentException("Field " + fieldId + " not found in schema " + schemaId);
    }
}
