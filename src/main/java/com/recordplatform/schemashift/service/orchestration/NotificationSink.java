package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.ChangeNotification;

/**
 * Delivery side of schema change UX. Implementations decide the channel.
 */
public interface NotificationSink {

    void notify(ChangeNotification notification);

    void recordDashboardEntry(ChangeNotification notification);
}
