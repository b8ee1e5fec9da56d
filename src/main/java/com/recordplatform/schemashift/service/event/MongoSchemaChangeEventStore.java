package com.recordplatform.schemashift.service.event;

import com.recordplatform.schemashift.exception.EventStoreException;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.repository.SchemaChangeEventRepository;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Event store backed by the {@code schema_change_events} collection.
 *
 * The processed transition is a single conditional update filtered on
 * {@code processed = false}, so two concurrent sweeps can both run the (idempotent)
 * fan-out for an event but only one of them performs the transition.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MongoSchemaChangeEventStore implements SchemaChangeEventStore {

    private final SchemaChangeEventRepository repository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public void append(SchemaChangeEvent event) {
        try {
            repository.save(event);
            log.info("Schema change event published: id={} type={} schema={} field={}",
                    event.getId(), event.getChangeType(), event.getSchemaId(), event.getFieldId());
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to append schema change event " + event.getId(), e);
        }
    }

    @Override
    public List<SchemaChangeEvent> queryUnprocessed(String organizationId, String schemaId) {
        try {
            if (schemaId == null) {
                return repository.findByOrganizationIdAndProcessedFalseOrderByTimestampAsc(organizationId);
            }
            return repository.findByOrganizationIdAndSchemaIdAndProcessedFalseOrderByTimestampAsc(
                    organizationId, schemaId);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to load unprocessed events for organization " + organizationId, e);
        }
    }

    @Override
    public List<SchemaChangeEvent> queryAllUnprocessed() {
        try {
            return repository.findByProcessedFalseOrderByTimestampAsc();
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to load unprocessed events", e);
        }
    }

    @Override
    public boolean markProcessed(String organizationId, String eventId) {
        Query query = new Query(Criteria.where("_id").is(eventId)
                .and("organizationId").is(organizationId)
                .and("processed").is(false));
        Update update = new Update()
                .set("processed", true)
                .set("processedAt", LocalDateTime.now(clock));
        try {
            UpdateResult result = mongoTemplate.updateFirst(query, update, SchemaChangeEvent.class);
            if (result.getModifiedCount() == 0) {
                log.debug("Event {} was already processed", eventId);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to mark event " + eventId + " processed", e);
        }
    }

    @Override
    public void recordMeasuredImpact(SchemaChangeEvent event) {
        Query query = new Query(Criteria.where("_id").is(event.getId())
                .and("organizationId").is(event.getOrganizationId()));
        Update update = new Update()
                .set("affectedSystems", event.getAffectedSystems())
                .set("impactMeasuredAt", event.getImpactMeasuredAt());
        try {
            mongoTemplate.updateFirst(query, update, SchemaChangeEvent.class);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to record measured impact for event " + event.getId(), e);
        }
    }

    @Override
    public List<SchemaChangeEvent> findSince(String organizationId, String schemaId, LocalDateTime since) {
        try {
            return repository.findByOrganizationIdAndSchemaIdAndTimestampAfterOrderByTimestampDesc(
                    organizationId, schemaId, since);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to load events for schema " + schemaId, e);
        }
    }
}
