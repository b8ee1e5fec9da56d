package com.recordplatform.schemashift.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Field types a record schema can declare. Wire names follow the platform's camelCase
 * convention ("longText", "phoneNumber", ...).
 */
public enum FieldType {
    TEXT("text"),
    LONG_TEXT("longText"),
    EMAIL("email"),
    URL("url"),
    PHONE_NUMBER("phoneNumber"),
    NUMBER("number"),
    CURRENCY("currency"),
    PERCENT("percent"),
    DATE("date"),
    DATE_TIME("dateTime"),
    TIME("time"),
    CHECKBOX("checkbox"),
    SINGLE_SELECT("singleSelect"),
    MULTI_SELECT("multiSelect"),
    LOOKUP("lookup"),
    ATTACHMENT("attachment"),
    RATING("rating"),
    FORMULA("formula");

    private static final Set<FieldType> TEXT_GROUP = EnumSet.of(TEXT, LONG_TEXT, EMAIL, URL, PHONE_NUMBER);
    private static final Set<FieldType> NUMERIC_GROUP = EnumSet.of(NUMBER, CURRENCY, PERCENT);
    private static final Set<FieldType> TEMPORAL_GROUP = EnumSet.of(DATE, DATE_TIME, TIME);

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static FieldType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + value));
    }

    public boolean isTextual() {
        return TEXT_GROUP.contains(this);
    }

    public boolean isNumeric() {
        return NUMERIC_GROUP.contains(this);
    }

    public boolean isTemporal() {
        return TEMPORAL_GROUP.contains(this);
    }

    /**
     * Whether values of this type can be mapped into {@code target} without losing meaning:
     * identical types, types from the same group, or any type widened into plain text.
     */
    public boolean isCompatibleWith(FieldType target) {
        if (this == target) {
            return true;
        }
        if (isTextual() && target.isTextual()) return true;
        if (isNumeric() && target.isNumeric()) return true;
        if (isTemporal() && target.isTemporal()) return true;
        return target == TEXT || target == LONG_TEXT;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
