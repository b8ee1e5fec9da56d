package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.Schema;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SchemaRepository extends MongoRepository<Schema, String> {

    Optional<Schema> findByIdAndOrganizationId(String id, String organizationId);

    List<Schema> findByOrganizationIdAndWorkspaceId(String organizationId, String workspaceId);
}
