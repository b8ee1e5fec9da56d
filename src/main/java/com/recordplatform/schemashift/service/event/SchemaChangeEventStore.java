package com.recordplatform.schemashift.service.event;

import com.recordplatform.schemashift.model.SchemaChangeEvent;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Durable log of schema change events. Implementations throw
 * {@link com.recordplatform.schemashift.exception.EventStoreException} when storage fails.
 */
public interface SchemaChangeEventStore {

    void append(SchemaChangeEvent event);

    /**
     * Unprocessed events of one organization, oldest first. {@code schemaId} may be null.
     */
    List<SchemaChangeEvent> queryUnprocessed(String organizationId, String schemaId);

    List<SchemaChangeEvent> queryAllUnprocessed();

    /**
     * Atomically flips {@code processed} from false to true.
     *
     * @return true if this call performed the transition, false if the event was already processed
     */
    boolean markProcessed(String organizationId, String eventId);

    /**
     * Persists the measured {@code itemsAffected} counts of an event.
     */
    void recordMeasuredImpact(SchemaChangeEvent event);

    /**
     * Events of one schema since the given instant, newest first.
     */
    List<SchemaChangeEvent> findSince(String organizationId, String schemaId, LocalDateTime since);
}
