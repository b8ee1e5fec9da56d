package com.recordplatform.schemashift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors invalidate the workflow; warnings keep it valid but flag it for review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowValidationResult {
    private String workflowId;
    private String workflowName;
    private boolean valid;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
