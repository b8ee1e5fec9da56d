package com.recordplatform.schemashift.service.event;

import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.service.diff.SchemaDiffEngine;
import com.recordplatform.schemashift.service.resolver.ResolverCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Diffs two schema snapshots and appends the resulting events to the event store, in the
 * order the diff produced them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaChangePublisher {

    private final SchemaDiffEngine diffEngine;
    private final SchemaChangeEventStore eventStore;
    private final ResolverCache resolverCache;

    public List<SchemaChangeEvent> publishChanges(Schema oldSchema, Schema newSchema, String organizationId) {
        List<SchemaChangeEvent> events = diffEngine.detectChanges(oldSchema, newSchema, organizationId);
        if (events.isEmpty()) {
            log.debug("No changes detected for schema {}", newSchema.getId());
            return events;
        }

        for (SchemaChangeEvent event : events) {
            eventStore.append(event);
        }
        resolverCache.clearSchema(newSchema.getId());

        log.info("Published {} change event(s) for schema {} in organization {}",
                events.size(), newSchema.getId(), organizationId);
        return events;
    }
}
