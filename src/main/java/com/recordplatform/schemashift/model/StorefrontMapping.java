package com.recordplatform.schemashift.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB document binding storefront product roles (price, title, sku, ...) to fields of
 * the schema that backs the product catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "storefront_mappings")
@CompoundIndex(name = "org_schema_idx", def = "{'organizationId': 1, 'schemaId': 1}")
public class StorefrontMapping {

    @Id
    private String id;

    private String organizationId;
    private String workspaceId;
    private String schemaId;
    private String schemaName;

    // product role -> field key
    @Builder.Default
    private Map<String, String> fieldBindings = new LinkedHashMap<>();

    private boolean needsReview;

    @Builder.Default
    private List<String> reviewNotes = new ArrayList<>();

    private LocalDateTime updatedAt;
}
