package com.recordplatform.schemashift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload handed to the notification sink. This core decides content and routing only,
 * never the delivery channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeNotification {

    private String organizationId;
    private String title;
    private String message;
    private String type;
    private String severity;
    private boolean blocking;

    /**
     * Stable identity of what this notification is about, e.g. {@code eventId:workflowId}.
     * Sinks use it to store a replayed notification only once.
     */
    private String deliveryKey;

    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static class Type {
        public static final String BLOCKING_CONFIRMATION = "schema_change_confirmation";
        public static final String FIX_WIZARD = "schema_change_fix_wizard";
        public static final String SCHEMA_CHANGE = "schema_change";
        public static final String WORKFLOW_ADVISORY = "workflow_field_advisory";
        public static final String INTEGRATION_REVIEW = "integration_mapping_review";
        public static final String STOREFRONT_REVIEW = "storefront_mapping_review";
    }

    public static class Action {
        public static final String CANCEL = "cancel";
        public static final String VIEW_IMPACT = "view_impact";
        public static final String FORCE = "force";
        public static final String OPEN_FIX_WIZARD = "open_fix_wizard";
        public static final String REVIEW_WORKFLOW = "review_workflow";
        public static final String REVIEW_MAPPING = "review_mapping";
    }
}
