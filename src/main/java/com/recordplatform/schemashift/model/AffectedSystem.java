package com.recordplatform.schemashift.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Impact of one schema change on one consumer category.
 * At diff time {@code itemsAffected} is a category-level prediction; the category's
 * consumer validator replaces it with a measured count during orchestration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedSystem {
    private AffectedSystemCategory system;
    private int itemsAffected;
    private boolean requiresUserAction;
    private boolean autoFixable;
    private String details;
}
