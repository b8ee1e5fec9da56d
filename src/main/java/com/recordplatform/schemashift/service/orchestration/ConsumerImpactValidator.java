package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.SchemaChangeEvent;

/**
 * Measures how many items of one consumer category depend on the field an event changed.
 */
public interface ConsumerImpactValidator {

    AffectedSystemCategory category();

    int countAffectedItems(SchemaChangeEvent event);
}
