package com.recordplatform.schemashift.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Severity of a schema change and the UX policy that follows from it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeverityAssessment {

    private SeverityLevel level;
    private boolean requiresImmediateAction;
    private boolean blockingAction;
    private String userMessage;
    private String recommendation;
    private int affectedItemCount;

    public enum SeverityLevel {
        CRITICAL("critical"),
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low");

        private final String label;

        SeverityLevel(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }

        public boolean isAtLeast(SeverityLevel other) {
            return ordinal() <= other.ordinal();
        }
    }
}
