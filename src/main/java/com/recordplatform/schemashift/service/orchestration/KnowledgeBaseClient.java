package com.recordplatform.schemashift.service.orchestration;

/**
 * Agent knowledge layer that indexes schema names and field vocabularies.
 */
public interface KnowledgeBaseClient {

    void refreshSchemaKnowledge(String organizationId, String workspaceId, String schemaId, String reason);
}
