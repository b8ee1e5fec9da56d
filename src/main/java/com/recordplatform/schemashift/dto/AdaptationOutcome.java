package com.recordplatform.schemashift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptationOutcome {
    private String adapterName;
    private boolean success;
    private String errorMessage;

    public static AdaptationOutcome success(String adapterName) {
        return AdaptationOutcome.builder()
                .adapterName(adapterName)
                .success(true)
                .build();
    }

    public static AdaptationOutcome failure(String adapterName, String errorMessage) {
        return AdaptationOutcome.builder()
                .adapterName(adapterName)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
