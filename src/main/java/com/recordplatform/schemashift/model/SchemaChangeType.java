package com.recordplatform.schemashift.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Atomic change kinds emitted by the schema diff. One event carries exactly one of these.
 */
public enum SchemaChangeType {
    FIELD_ADDED("field_added"),
    FIELD_RENAMED("field_renamed"),
    FIELD_KEY_CHANGED("field_key_changed"),
    FIELD_DELETED("field_deleted"),
    FIELD_TYPE_CHANGED("field_type_changed"),
    SCHEMA_RENAMED("schema_renamed");

    private final String wireName;

    SchemaChangeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SchemaChangeType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown schema change type: " + value));
    }

    public boolean isFieldLevel() {
        return this != SCHEMA_RENAMED;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
