package com.recordplatform.schemashift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the orchestrator did with one schema change event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventProcessingResult {

    private String eventId;
    private SeverityAssessment assessment;
    private ConversionDecision conversionDecision;

    @Builder.Default
    private List<AdaptationOutcome> adapterOutcomes = new ArrayList<>();

    // False when another sweep already flipped the flag
    private boolean markedProcessed;

    public long failedAdapterCount() {
        return adapterOutcomes.stream().filter(o -> !o.isSuccess()).count();
    }

    public enum ConversionDecision {
        NOT_APPLICABLE,
        AUTO_CONVERTED,
        APPROVAL_REQUESTED,
        SKIPPED_NO_ENGINE,
        FAILED
    }
}
