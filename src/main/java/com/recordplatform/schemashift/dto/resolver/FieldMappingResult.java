package com.recordplatform.schemashift.dto.resolver;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of mapping a source field onto a target field. A type mismatch only adds a
 * warning; {@code compatible} turns false only when a side cannot be resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldMappingResult {
    private ResolvedField sourceField;
    private ResolvedField targetField;
    private boolean compatible;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
