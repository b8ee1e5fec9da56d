package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.dto.SeverityAssessment;
import com.recordplatform.schemashift.dto.SeverityAssessment.SeverityLevel;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a severity assessment into the notifications the user sees.
 *
 * critical: blocking confirmation (cancel, view impact, force) and a dashboard entry
 * high: fix wizard notification and a dashboard entry
 * medium: plain notification and a dashboard entry
 * low: dashboard entry only
 *
 * Sink failures are logged and swallowed; a missed notification never stops adaptation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChangeNotificationRouter {

    private final NotificationSink notificationSink;

    public void route(SchemaChangeEvent event, SeverityAssessment assessment) {
        ChangeNotification notification = buildNotification(event, assessment);

        if (assessment.getLevel() != SeverityLevel.LOW) {
            deliver(event, "notification", () -> notificationSink.notify(notification));
        }
        deliver(event, "dashboard entry", () -> notificationSink.recordDashboardEntry(notification));
    }

    ChangeNotification buildNotification(SchemaChangeEvent event, SeverityAssessment assessment) {
        SeverityLevel level = assessment.getLevel();

        String type = switch (level) {
            case CRITICAL -> ChangeNotification.Type.BLOCKING_CONFIRMATION;
            case HIGH -> ChangeNotification.Type.FIX_WIZARD;
            case MEDIUM, LOW -> ChangeNotification.Type.SCHEMA_CHANGE;
        };
        List<String> actions = switch (level) {
            case CRITICAL -> List.of(ChangeNotification.Action.CANCEL,
                    ChangeNotification.Action.VIEW_IMPACT,
                    ChangeNotification.Action.FORCE);
            case HIGH -> List.of(ChangeNotification.Action.OPEN_FIX_WIZARD,
                    ChangeNotification.Action.VIEW_IMPACT);
            case MEDIUM, LOW -> List.of(ChangeNotification.Action.VIEW_IMPACT);
        };

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.getId());
        metadata.put("schemaId", event.getSchemaId());
        metadata.put("changeType", event.getChangeType().getWireName());
        if (event.getFieldId() != null) {
            metadata.put("fieldId", event.getFieldId());
        }
        metadata.put("affectedItemCount", assessment.getAffectedItemCount());
        metadata.put("recommendation", assessment.getRecommendation());

        return ChangeNotification.builder()
                .organizationId(event.getOrganizationId())
                .title(title(event, level))
                .message(assessment.getUserMessage())
                .type(type)
                .severity(level.getLabel())
                .blocking(assessment.isBlockingAction())
                .deliveryKey(event.getId())
                .actions(actions)
                .metadata(metadata)
                .build();
    }

    private String title(SchemaChangeEvent event, SeverityLevel level) {
        return switch (level) {
            case CRITICAL -> "Confirm schema change";
            case HIGH -> "Schema change needs attention";
            case MEDIUM, LOW -> "Schema updated: " + event.getChangeType().getWireName().replace('_', ' ');
        };
    }

    private void deliver(SchemaChangeEvent event, String what, Runnable delivery) {
        try {
            delivery.run();
        } catch (Exception e) {
            log.error("Failed to deliver {} for event {}: {}", what, event.getId(), e.getMessage(), e);
        }
    }
}
