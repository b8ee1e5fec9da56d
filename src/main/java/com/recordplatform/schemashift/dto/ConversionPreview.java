package com.recordplatform.schemashift.dto;

import com.recordplatform.schemashift.model.FieldType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sampled dry run of a field type conversion, produced by the type-conversion collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionPreview {

    private String schemaId;
    private String fieldKey;
    private FieldType fromType;
    private FieldType toType;
    private int totalRecords;
    private int sampledRecords;
    private int failedConversions;

    @Builder.Default
    private List<Sample> samples = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Sample {
        private String recordId;
        private Object before;
        private Object after;
        private boolean success;
        private String error;
    }
}
