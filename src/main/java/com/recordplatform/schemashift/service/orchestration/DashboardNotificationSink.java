package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.model.DashboardEntry;
import com.recordplatform.schemashift.repository.DashboardEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Default sink: both channels land in the {@code schema_change_notifications} collection,
 * distinguished by {@link DashboardEntry#getChannel()}. Push delivery is left to whatever
 * reads that collection.
 *
 * Notifications carrying a delivery key are stored at most once per channel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DashboardNotificationSink implements NotificationSink {

    private final DashboardEntryRepository repository;
    private final Clock clock;

    @Override
    public void notify(ChangeNotification notification) {
        save(notification, DashboardEntry.Channel.NOTIFICATION);
    }

    @Override
    public void recordDashboardEntry(ChangeNotification notification) {
        save(notification, DashboardEntry.Channel.DASHBOARD);
    }

    private void save(ChangeNotification notification, String channel) {
        String id = entryId(notification, channel);
        if (notification.getDeliveryKey() != null && repository.existsById(id)) {
            log.debug("{} entry {} already recorded, skipping", channel, id);
            return;
        }
        DashboardEntry entry = DashboardEntry.builder()
                .id(id)
                .organizationId(notification.getOrganizationId())
                .channel(channel)
                .title(notification.getTitle())
                .message(notification.getMessage())
                .type(notification.getType())
                .severity(notification.getSeverity())
                .blocking(notification.isBlocking())
                .actions(new ArrayList<>(notification.getActions()))
                .metadata(new LinkedHashMap<>(notification.getMetadata()))
                .acknowledged(false)
                .createdAt(LocalDateTime.now(clock))
                .build();
        repository.save(entry);
        log.debug("Stored {} entry '{}' for organization {}", channel, entry.getTitle(), entry.getOrganizationId());
    }

    // One document per channel for a keyed notification
    static String entryId(ChangeNotification notification, String channel) {
        if (notification.getDeliveryKey() == null) {
            return UUID.randomUUID().toString();
        }
        return channel.toLowerCase() + ":" + notification.getDeliveryKey();
    }
}
