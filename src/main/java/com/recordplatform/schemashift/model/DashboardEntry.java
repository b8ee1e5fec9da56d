package com.recordplatform.schemashift.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB document backing the schema-change dashboard and the notification inbox.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "schema_change_notifications")
public class DashboardEntry {

    @Id
    private String id;

    @Indexed
    private String organizationId;

    private String channel;         // NOTIFICATION or DASHBOARD
    private String title;
    private String message;
    private String type;
    private String severity;
    private boolean blocking;

    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private boolean acknowledged;
    private LocalDateTime createdAt;

    public static class Channel {
        public static final String NOTIFICATION = "NOTIFICATION";
        public static final String DASHBOARD = "DASHBOARD";
    }
}
