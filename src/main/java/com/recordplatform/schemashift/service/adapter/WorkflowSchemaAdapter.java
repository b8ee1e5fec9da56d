package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.service.orchestration.SchemaChangeAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Workflows resolve field references at run time, so adapting them means revalidating
 * and flagging, never rewriting.
 */
@Component
@RequiredArgsConstructor
public class WorkflowSchemaAdapter implements SchemaChangeAdapter {

    private final WorkflowValidator workflowValidator;

    @Override
    public String name() {
        return "workflows";
    }

    @Override
    public void adapt(SchemaChangeEvent event) {
        workflowValidator.validateWorkflowsForSchema(event);
    }
}
