package com.recordplatform.schemashift.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class FieldTypeTest {

    @ParameterizedTest(name = "{0} -> {1} compatible={2}")
    @CsvSource({
            "NUMBER, TEXT, true",
            "NUMBER, LONG_TEXT, true",
            "DATE, TEXT, true",
            // widening only targets plain text, not the structured text types
            "NUMBER, EMAIL, false",
            "NUMBER, URL, false",
            "DATE, PHONE_NUMBER, false",
            "EMAIL, URL, true",
            "CURRENCY, PERCENT, true",
            "DATE, DATE_TIME, true",
            "TEXT, NUMBER, false",
            "NUMBER, DATE, false"
    })
    void compatibility(FieldType from, FieldType to, boolean compatible) {
        assertThat(from.isCompatibleWith(to)).isEqualTo(compatible);
    }

    @Test
    void readsWireNamesAndEnumNames() {
        assertThat(FieldType.fromWireName("phoneNumber")).isEqualTo(FieldType.PHONE_NUMBER);
        assertThat(FieldType.fromWireName("long_text")).isEqualTo(FieldType.LONG_TEXT);
    }
}
