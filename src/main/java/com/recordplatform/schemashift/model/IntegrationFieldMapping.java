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
import java.util.List;

/**
 * MongoDB document mapping local schema fields to fields of a third-party system.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "integration_field_mappings")
@CompoundIndex(name = "org_schema_idx", def = "{'organizationId': 1, 'schemaId': 1}")
public class IntegrationFieldMapping {

    @Id
    private String id;

    private String integrationId;
    private String integrationName;     // salesforce, hubspot, shopify, ...
    private String organizationId;
    private String workspaceId;
    private String schemaId;

    @Builder.Default
    private List<Rule> rules = new ArrayList<>();

    private boolean needsReview;
    private LocalDateTime updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Rule {
        private String id;
        private String localField;      // field key in the local schema
        private String externalField;
        private boolean required;
        private boolean readonly;       // sync disabled for this rule
    }
}
