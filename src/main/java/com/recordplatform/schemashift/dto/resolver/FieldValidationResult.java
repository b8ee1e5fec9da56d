package com.recordplatform.schemashift.dto.resolver;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldValidationResult {
    private boolean valid;
    private ResolvedField field;            // set when valid
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
