package com.recordplatform.schemashift.repository;

import com.recordplatform.schemashift.model.Workflow;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkflowRepository extends MongoRepository<Workflow, String> {

    List<Workflow> findByOrganizationIdAndWorkspaceIdAndStatus(String organizationId, String workspaceId, String status);
}
