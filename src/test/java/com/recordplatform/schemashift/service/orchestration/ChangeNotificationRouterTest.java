package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.dto.SeverityAssessment;
import com.recordplatform.schemashift.dto.SeverityAssessment.SeverityLevel;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ChangeNotificationRouterTest {

    @Mock
    private NotificationSink notificationSink;

    @InjectMocks
    private ChangeNotificationRouter router;

    @Test
    void lowSeverityOnlyReachesTheDashboard() {
        router.route(event(), assessment(SeverityLevel.LOW, false));

        verify(notificationSink, never()).notify(any());
        verify(notificationSink).recordDashboardEntry(any());
    }

    @Test
    void highSeverityOffersTheFixWizard() {
        router.route(event(), assessment(SeverityLevel.HIGH, false));

        ArgumentCaptor<ChangeNotification> captor = ArgumentCaptor.forClass(ChangeNotification.class);
        verify(notificationSink).notify(captor.capture());
        verify(notificationSink).recordDashboardEntry(captor.getValue());
        assertThat(captor.getValue().getType()).isEqualTo(ChangeNotification.Type.FIX_WIZARD);
        assertThat(captor.getValue().getActions()).contains(ChangeNotification.Action.OPEN_FIX_WIZARD);
        assertThat(captor.getValue().getSeverity()).isEqualTo("high");
        assertThat(captor.getValue().getMetadata())
                .containsEntry("eventId", "sce_1")
                .containsEntry("changeType", "field_key_changed");
        assertThat(captor.getValue().getDeliveryKey()).isEqualTo("sce_1");
    }

    @Test
    void mediumSeverityIsAPlainNotification() {
        ChangeNotification notification = router.buildNotification(event(), assessment(SeverityLevel.MEDIUM, false));

        assertThat(notification.getType()).isEqualTo(ChangeNotification.Type.SCHEMA_CHANGE);
        assertThat(notification.isBlocking()).isFalse();
        assertThat(notification.getTitle()).isEqualTo("Schema updated: field key changed");
    }

    @Test
    void criticalSeverityBlocksWithConfirmationActions() {
        ChangeNotification notification = router.buildNotification(event(), assessment(SeverityLevel.CRITICAL, true));

        assertThat(notification.getType()).isEqualTo(ChangeNotification.Type.BLOCKING_CONFIRMATION);
        assertThat(notification.isBlocking()).isTrue();
        assertThat(notification.getActions()).containsExactly("cancel", "view_impact", "force");
    }

    @Test
    void dashboardEntryIsRecordedEvenIfNotifyFails() {
        doThrow(new IllegalStateException("gateway down")).when(notificationSink).notify(any());

        router.route(event(), assessment(SeverityLevel.CRITICAL, true));

        verify(notificationSink).recordDashboardEntry(any());
    }

    private static SchemaChangeEvent event() {
        return SchemaChangeEvent.builder()
                .id("sce_1")
                .organizationId("org-1")
                .schemaId("schema-1")
                .fieldId("f2")
                .changeType(SchemaChangeType.FIELD_KEY_CHANGED)
                .oldFieldKey("email")
                .newFieldKey("contact_email")
                .build();
    }

    private static SeverityAssessment assessment(SeverityLevel level, boolean blocking) {
        return SeverityAssessment.builder()
                .level(level)
                .blockingAction(blocking)
                .requiresImmediateAction(level.isAtLeast(SeverityLevel.HIGH))
                .userMessage("Field changed")
                .recommendation("Review")
                .affectedItemCount(7)
                .build();
    }
}
