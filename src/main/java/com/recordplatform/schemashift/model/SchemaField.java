package com.recordplatform.schemashift.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One field of a record schema. {@code id} is the field's identity and never changes once
 * assigned; key, label and type may all be edited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaField {
    private String id;
    private String key;             // machine name referenced by records and consumers
    private String label;           // display name
    private FieldType type;
    private boolean hidden;
    private List<String> options;   // select choices, when the type has any
    private Map<String, Object> config;
}
