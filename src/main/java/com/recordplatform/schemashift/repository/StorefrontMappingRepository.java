package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.StorefrontMapping;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StorefrontMappingRepository extends MongoRepository<StorefrontMapping, String> {

    List<StorefrontMapping> findByOrganizationIdAndSchemaId(String organizationId, String schemaId);
}
