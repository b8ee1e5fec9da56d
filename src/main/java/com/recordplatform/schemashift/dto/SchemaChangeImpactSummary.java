package com.recordplatform.schemashift.dto;

import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only report of recent schema changes and their measured impact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaChangeImpactSummary {

    private String schemaId;
    private LocalDateTime windowStart;
    private int totalEvents;
    private int unprocessedEvents;

    @Builder.Default
    private Map<SchemaChangeType, Long> eventsByChangeType = new EnumMap<>(SchemaChangeType.class);

    // Sum of itemsAffected per category across the window
    @Builder.Default
    private Map<AffectedSystemCategory, Integer> itemsAffectedBySystem = new EnumMap<>(AffectedSystemCategory.class);

    @Builder.Default
    private List<SchemaChangeEvent> recentEvents = new ArrayList<>();
}
