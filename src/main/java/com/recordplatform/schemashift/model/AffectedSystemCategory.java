package com.recordplatform.schemashift.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Downstream consumer categories that can depend on a schema's shape.
 */
public enum AffectedSystemCategory {
    WORKFLOWS("workflows"),
    INTEGRATIONS("integrations"),
    STOREFRONT("ecommerce"),
    KNOWLEDGE_BASE("ai_agent"),
    API("api"),
    FORMS("forms");

    private final String wireName;

    AffectedSystemCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AffectedSystemCategory fromWireName(String value) {
        return Arrays.stream(values())
                .filter(c -> c.wireName.equals(value) || c.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown affected system: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
