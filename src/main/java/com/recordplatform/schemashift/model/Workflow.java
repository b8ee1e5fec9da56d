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
 * MongoDB document for a stored automation. Field references are loose strings resolved
 * against the trigger schema at run time, so they survive label and key drift.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "workflows")
@CompoundIndex(name = "org_ws_status_idx", def = "{'organizationId': 1, 'workspaceId': 1, 'status': 1}")
public class Workflow {

    @Id
    private String id;

    private String organizationId;
    private String workspaceId;
    private String name;
    private String status;          // ACTIVE, PAUSED, DRAFT

    private Trigger trigger;

    @Builder.Default
    private List<Action> actions = new ArrayList<>();

    // Outcome of the last schema validation
    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();
    @Builder.Default
    private List<String> validationWarnings = new ArrayList<>();
    private LocalDateTime lastValidatedAt;

    public boolean referencesSchema(String schemaId) {
        return trigger != null && schemaId != null && schemaId.equals(trigger.getSchemaId());
    }

    /**
     * Every field reference held by the trigger and the actions' field mappings, in declaration order.
     */
    public List<String> fieldReferences() {
        List<String> refs = new ArrayList<>();
        if (trigger != null && trigger.getFieldReferences() != null) {
            refs.addAll(trigger.getFieldReferences());
        }
        if (actions != null) {
            for (Action action : actions) {
                if (action.getFieldMappings() != null) {
                    refs.addAll(action.getFieldMappings().values());
                }
            }
        }
        return refs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trigger {
        private String type;        // entity.created, entity.updated, ...
        private String schemaId;
        @Builder.Default
        private List<String> fieldReferences = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Action {
        private String id;
        private String type;
        // target parameter -> source field reference
        @Builder.Default
        private Map<String, String> fieldMappings = new LinkedHashMap<>();
    }

    public static class Status {
        public static final String ACTIVE = "ACTIVE";
        public static final String PAUSED = "PAUSED";
        public static final String DRAFT = "DRAFT";
    }
}
