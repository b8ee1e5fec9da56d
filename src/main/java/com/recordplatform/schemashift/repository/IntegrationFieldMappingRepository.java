package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.IntegrationFieldMapping;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IntegrationFieldMappingRepository extends MongoRepository<IntegrationFieldMapping, String> {

    List<IntegrationFieldMapping> findByOrganizationIdAndSchemaId(String organizationId, String schemaId);
}
