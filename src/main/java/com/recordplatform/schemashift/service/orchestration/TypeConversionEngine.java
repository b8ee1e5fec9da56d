package com.recordplatform.schemashift.service.orchestration;

import com.recordplatform.schemashift.dto.ConversionPreview;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.SchemaChangeEvent;

/**
 * Converts stored record values when a field changes type. Optional; when no bean is
 * present type changes are assessed and routed but existing values are left alone.
 */
public interface TypeConversionEngine {

    boolean isSafeConversion(FieldType from, FieldType to);

    ConversionPreview generateConversionPreview(String schemaId, String fieldKey,
                                                FieldType from, FieldType to, int sampleSize);

    void convertFieldType(String schemaId, String fieldKey, FieldType from, FieldType to);

    void createConversionApprovalRequest(SchemaChangeEvent event, ConversionPreview preview);
}
