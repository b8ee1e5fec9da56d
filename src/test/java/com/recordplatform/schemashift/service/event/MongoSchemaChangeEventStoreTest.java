package com.recordplatform.schemashift.service.event;

import com.mongodb.client.result.UpdateResult;
import com.recordplatform.schemashift.exception.EventStoreException;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.repository.SchemaChangeEventRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoSchemaChangeEventStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SchemaChangeEventRepository repository;

    @Mock
    private MongoTemplate mongoTemplate;

    private MongoSchemaChangeEventStore store;

    @BeforeEach
    void setUp() {
        store = new MongoSchemaChangeEventStore(repository, mongoTemplate, CLOCK);
    }

    @Test
    void markProcessedIsAConditionalUpdate() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SchemaChangeEvent.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        boolean marked = store.markProcessed("org-1", "sce_1");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(SchemaChangeEvent.class));

        assertThat(marked).isTrue();
        Document filter = query.getValue().getQueryObject();
        assertThat(filter.get("_id")).isEqualTo("sce_1");
        assertThat(filter.get("organizationId")).isEqualTo("org-1");
        assertThat(filter.get("processed")).isEqualTo(false);
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("processed")).isEqualTo(true);
    }

    @Test
    void markProcessedReportsAlreadyProcessed() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SchemaChangeEvent.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.markProcessed("org-1", "sce_1")).isFalse();
    }

    @Test
    void markProcessedWrapsDataAccessFailures() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SchemaChangeEvent.class)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> store.markProcessed("org-1", "sce_1"))
                .isInstanceOf(EventStoreException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void recordMeasuredImpactStoresCountsWithTheMeasurementTime() {
        SchemaChangeEvent event = SchemaChangeEvent.builder()
                .id("sce_1")
                .organizationId("org-1")
                .changeType(SchemaChangeType.FIELD_DELETED)
                .impactMeasuredAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .build();

        store.recordMeasuredImpact(event);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(SchemaChangeEvent.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set).containsKeys("affectedSystems", "impactMeasuredAt");
        assertThat(set.get("impactMeasuredAt")).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
    }

    @Test
    void queryUnprocessedWithoutSchemaCoversWholeOrganization() {
        SchemaChangeEvent event = SchemaChangeEvent.builder().id("sce_1").changeType(SchemaChangeType.FIELD_ADDED).build();
        when(repository.findByOrganizationIdAndProcessedFalseOrderByTimestampAsc("org-1")).thenReturn(List.of(event));

        assertThat(store.queryUnprocessed("org-1", null)).containsExactly(event);
    }

    @Test
    void queryUnprocessedWithSchemaNarrowsTheQuery() {
        when(repository.findByOrganizationIdAndSchemaIdAndProcessedFalseOrderByTimestampAsc("org-1", "schema-1"))
                .thenReturn(List.of());

        assertThat(store.queryUnprocessed("org-1", "schema-1")).isEmpty();
    }

    @Test
    void fetchFailureSurfacesAsEventStoreException() {
        when(repository.findByProcessedFalseOrderByTimestampAsc())
                .thenThrow(new DataAccessResourceFailureException("primary unavailable"));

        assertThatThrownBy(() -> store.queryAllUnprocessed())
                .isInstanceOf(EventStoreException.class)
                .hasMessageContaining("unprocessed");
    }
}
