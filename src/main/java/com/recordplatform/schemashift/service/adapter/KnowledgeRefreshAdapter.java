package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.service.orchestration.KnowledgeBaseClient;
import com.recordplatform.schemashift.service.orchestration.SchemaChangeAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class KnowledgeRefreshAdapter implements SchemaChangeAdapter {

    private final Optional<KnowledgeBaseClient> knowledgeBaseClient;

    @Override
    public String name() {
        return "knowledge_base";
    }

    @Override
    public void adapt(SchemaChangeEvent event) {
        boolean vocabularyChanged = switch (event.getChangeType()) {
            case SCHEMA_RENAMED, FIELD_RENAMED, FIELD_KEY_CHANGED, FIELD_DELETED -> true;
            case FIELD_ADDED, FIELD_TYPE_CHANGED -> false;
        };
        if (!vocabularyChanged) {
            return;
        }
        if (knowledgeBaseClient.isEmpty()) {
            log.debug("No knowledge base client configured, skipping refresh for event {}", event.getId());
            return;
        }
        knowledgeBaseClient.get().refreshSchemaKnowledge(event.getOrganizationId(), event.getWorkspaceId(),
                event.getSchemaId(), event.getChangeType().getWireName());
        log.info("Requested knowledge refresh for schema {} after {}", event.getSchemaId(), event.getChangeType());
    }
}
