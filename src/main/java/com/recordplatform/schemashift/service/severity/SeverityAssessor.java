package com.recordplatform.schemashift.service.severity;

import com.recordplatform.schemashift.dto.SeverityAssessment;
import com.recordplatform.schemashift.dto.SeverityAssessment.SeverityLevel;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Maps a schema change event to a severity level and UX policy.
 *
 * The rule table is a switch expression over {@code SchemaChangeType}, so a change type
 * without a rule does not compile.
 */
@Service
@Slf4j
public class SeverityAssessor {

    private static final int HIGH_IMPACT_THRESHOLD = 5;

    /**
     * Conversions that parse free text into structured values and routinely fail on real data.
     */
    private static final Map<FieldType, Set<FieldType>> RISKY_CONVERSIONS = Map.of(
            FieldType.TEXT, Set.of(FieldType.NUMBER, FieldType.CURRENCY, FieldType.DATE),
            FieldType.LONG_TEXT, Set.of(FieldType.NUMBER, FieldType.CURRENCY)
    );

    /**
     * Assess using the counts already recorded on the event's affected systems.
     */
    public SeverityAssessment assessSeverity(SchemaChangeEvent event) {
        return assessSeverity(event, event.totalItemsAffected());
    }

    public SeverityAssessment assessSeverity(SchemaChangeEvent event, int affectedItemCount) {
        SeverityAssessment assessment = switch (event.getChangeType()) {
            case FIELD_DELETED -> assessDeletion(event, affectedItemCount);
            case FIELD_TYPE_CHANGED -> assessTypeChange(event, affectedItemCount);
            case FIELD_RENAMED, FIELD_KEY_CHANGED -> assessRename(event, affectedItemCount);
            case SCHEMA_RENAMED -> assessment(SeverityLevel.MEDIUM, false, affectedItemCount,
                    "Schema renamed from '" + event.getOldSchemaName() + "' to '" + event.getNewSchemaName() + "'.",
                    "Storefront and knowledge references are refreshed automatically.");
            case FIELD_ADDED -> assessment(SeverityLevel.LOW, false, affectedItemCount,
                    "Field '" + event.getNewFieldName() + "' added.",
                    "No action needed.");
        };

        log.debug("Event {} ({}) assessed {} with {} affected item(s)",
                event.getId(), event.getChangeType(), assessment.getLevel(), affectedItemCount);
        return assessment;
    }

    public boolean isRiskyConversion(FieldType from, FieldType to) {
        return from != null && to != null && RISKY_CONVERSIONS.getOrDefault(from, Set.of()).contains(to);
    }

    private SeverityAssessment assessDeletion(SchemaChangeEvent event, int count) {
        String field = event.getOldFieldName() != null ? event.getOldFieldName() : event.getOldFieldKey();
        if (count > 0) {
            return assessment(SeverityLevel.CRITICAL, true, count,
                    "Deleting field '" + field + "' breaks " + count + " dependent item(s).",
                    "Review the impact before deleting, or remap the dependent items to another field.");
        }
        return assessment(SeverityLevel.LOW, false, count,
                "Field '" + field + "' deleted. Nothing depends on it.",
                "No action needed.");
    }

    private SeverityAssessment assessTypeChange(SchemaChangeEvent event, int count) {
        FieldType from = event.getOldFieldType();
        FieldType to = event.getNewFieldType();
        if (isRiskyConversion(from, to)) {
            return assessment(SeverityLevel.HIGH, false, count,
                    "Converting '" + event.getNewFieldName() + "' from " + from + " to " + to
                            + " may fail for existing values.",
                    "Review the conversion preview and approve it before existing records are converted.");
        }
        return assessment(SeverityLevel.MEDIUM, false, count,
                "Field '" + event.getNewFieldName() + "' changed from " + from + " to " + to + ".",
                "Existing values are converted automatically.");
    }

    private SeverityAssessment assessRename(SchemaChangeEvent event, int count) {
        String change = "'" + event.previousFieldReference() + "' is now '" + event.currentFieldReference() + "'";
        if (count > HIGH_IMPACT_THRESHOLD) {
            return assessment(SeverityLevel.HIGH, false, count,
                    "Field " + change + "; " + count + " item(s) reference the old name.",
                    "Open the fix wizard to review and update the affected items.");
        }
        if (count > 0) {
            return assessment(SeverityLevel.MEDIUM, false, count,
                    "Field " + change + "; " + count + " item(s) reference the old name.",
                    "Affected items are updated automatically where possible.");
        }
        return assessment(SeverityLevel.LOW, false, count,
                "Field " + change + ".",
                "No action needed.");
    }

    private SeverityAssessment assessment(SeverityLevel level, boolean blocking, int count,
                                          String userMessage, String recommendation) {
        return SeverityAssessment.builder()
                .level(level)
                .requiresImmediateAction(level.isAtLeast(SeverityLevel.HIGH))
                .blockingAction(blocking)
                .userMessage(userMessage)
                .recommendation(recommendation)
                .affectedItemCount(count)
                .build();
    }
}
