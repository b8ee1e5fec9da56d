package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.model.SchemaChangeEvent;

/**
 * A dependent subsystem that repairs its own state after a schema change.
 * Implementations must tolerate seeing the same event more than once.
 */
public interface SchemaChangeAdapter {

    String name();

    void adapt(SchemaChangeEvent event);
}
