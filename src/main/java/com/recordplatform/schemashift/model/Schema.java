package com.recordplatform.schemashift.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB document holding the current snapshot of a tenant's record schema.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Document(collection = "schemas")
public class Schema {

    @Id
    private String id;

    @Indexed
    private String organizationId;

    @Indexed
    private String workspaceId;

    private String name;

    @Builder.Default
    private List<SchemaField> fields = new ArrayList<>();

    private int version;
    private LocalDateTime updatedAt;

    public Optional<SchemaField> findFieldById(String fieldId) {
        return fields.stream()
                .filter(f -> f.getId() != null && f.getId().equals(fieldId))
                .findFirst();
    }
}
