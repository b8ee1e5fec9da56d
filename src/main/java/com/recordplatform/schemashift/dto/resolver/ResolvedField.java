package com.recordplatform.schemashift.dto.resolver;

import com.fasterxml.jackson.annotation.JsonValue;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.SchemaField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A field matched by the resolver together with how certain the match is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedField {
    private String fieldId;
    private String fieldKey;
    private String fieldLabel;
    private FieldType fieldType;
    private SchemaField field;
    private double confidence;
    private MatchType matchType;

    public static ResolvedField of(SchemaField field, MatchType matchType) {
        return ResolvedField.builder()
                .fieldId(field.getId())
                .fieldKey(field.getKey())
                .fieldLabel(field.getLabel())
                .fieldType(field.getType())
                .field(field)
                .confidence(matchType.getConfidence())
                .matchType(matchType)
                .build();
    }

    public enum MatchType {
        EXACT_KEY("exact_key", 1.0),
        EXACT_LABEL("exact_label", 0.95),
        ALIAS("alias", 0.8),
        FUZZY("fuzzy", 0.6),
        TYPE("type", 0.5);

        private final String wireName;
        private final double confidence;

        MatchType(String wireName, double confidence) {
            this.wireName = wireName;
            this.confidence = confidence;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        public double getConfidence() {
            return confidence;
        }
    }
}
