package com.recordplatform.schemashift.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB document recording one atomic schema change.
 * Created only by the diff engine, consumed only by the change orchestrator.
 * {@code processed} moves from false to true once and is never reverted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "schema_change_events")
@CompoundIndex(name = "org_processed_idx", def = "{'organizationId': 1, 'processed': 1}")
@CompoundIndex(name = "org_schema_ts_idx", def = "{'organizationId': 1, 'schemaId': 1, 'timestamp': -1}")
public class SchemaChangeEvent {

    @Id
    private String id;

    private String organizationId;
    private String workspaceId;

    @Indexed
    private String schemaId;

    private LocalDateTime timestamp;
    private SchemaChangeType changeType;

    // Field changes
    private String fieldId;
    private String oldFieldName;
    private String newFieldName;
    private String oldFieldKey;
    private String newFieldKey;
    private FieldType oldFieldType;
    private FieldType newFieldType;

    // Schema changes
    private String oldSchemaName;
    private String newSchemaName;

    @Builder.Default
    private List<AffectedSystem> affectedSystems = new ArrayList<>();

    // Set once consumer counts replace the predicted ones; later runs reuse them
    private LocalDateTime impactMeasuredAt;

    private boolean processed;
    private LocalDateTime processedAt;
    private LocalDateTime createdAt;

    public int totalItemsAffected() {
        return affectedSystems == null ? 0 : affectedSystems.stream()
                .mapToInt(AffectedSystem::getItemsAffected)
                .sum();
    }

    /**
     * Key the field carried before the change, falling back to its label when the key is absent.
     */
    public String previousFieldReference() {
        return oldFieldKey != null && !oldFieldKey.isBlank() ? oldFieldKey : oldFieldName;
    }

    public String currentFieldReference() {
        return newFieldKey != null && !newFieldKey.isBlank() ? newFieldKey : newFieldName;
    }
}
