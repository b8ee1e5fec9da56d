package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.SchemaChangeEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SchemaChangeEventRepository extends MongoRepository<SchemaChangeEvent, String> {

    List<SchemaChangeEvent> findByOrganizationIdAndProcessedFalseOrderByTimestampAsc(String organizationId);

    List<SchemaChangeEvent> findByOrganizationIdAndSchemaIdAndProcessedFalseOrderByTimestampAsc(
            String organizationId, String schemaId);

    List<SchemaChangeEvent> findByProcessedFalseOrderByTimestampAsc();

    List<SchemaChangeEvent> findByOrganizationIdAndSchemaIdAndTimestampAfterOrderByTimestampDesc(
            String organizationId, String schemaId, LocalDateTime since);
}
