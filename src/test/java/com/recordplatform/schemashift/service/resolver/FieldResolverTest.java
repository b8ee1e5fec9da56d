package com.recordplatform.schemashift.service.resolver;

import com.recordplatform.schemashift.TestFixtures;
import com.recordplatform.schemashift.dto.resolver.FieldMappingResult;
import com.recordplatform.schemashift.dto.resolver.FieldQuery;
import com.recordplatform.schemashift.dto.resolver.FieldValidationResult;
import com.recordplatform.schemashift.dto.resolver.ResolvedField;
import com.recordplatform.schemashift.dto.resolver.ResolvedField.MatchType;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaField;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldResolverTest {

    private final FieldResolver resolver = new FieldResolver();

    @Test
    void resolvesExactKeyWithFullConfidence() {
        Schema schema = schemaOf(field("f1", "email", "Email", FieldType.EMAIL));

        Optional<ResolvedField> resolved = resolver.resolveField(schema, "email");

        assertThat(resolved).isPresent();
        assertThat(resolved.get().getMatchType()).isEqualTo(MatchType.EXACT_KEY);
        assertThat(resolved.get().getConfidence()).isEqualTo(1.0);
        assertThat(resolved.get().getFieldId()).isEqualTo("f1");
    }

    @Test
    void exactKeyWinsOverEarlierLabelMatch() {
        Schema schema = schemaOf(
                field("f1", "work_email", "email", FieldType.EMAIL),
                field("f2", "email", "Email", FieldType.EMAIL));

        ResolvedField resolved = resolver.resolveField(schema, "email").orElseThrow();

        assertThat(resolved.getFieldKey()).isEqualTo("email");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.EXACT_KEY);
    }

    @Test
    void resolvesExactLabel() {
        Schema schema = TestFixtures.contactSchema();

        ResolvedField resolved = resolver.resolveField(schema, "Deal Value").orElseThrow();

        assertThat(resolved.getFieldKey()).isEqualTo("deal_value");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.EXACT_LABEL);
        assertThat(resolved.getConfidence()).isEqualTo(0.95);
    }

    @Test
    void commonAliasTableMapsEmailToContactEmail() {
        Schema schema = schemaOf(field("f1", "contact_email", "Contact Email", FieldType.EMAIL));

        ResolvedField resolved = resolver.resolveFieldWithCommonAliases(schema, "email").orElseThrow();

        assertThat(resolved.getFieldKey()).isEqualTo("contact_email");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.ALIAS);
        assertThat(resolved.getConfidence()).isEqualTo(0.8);
    }

    @Test
    void commonAliasesIncludeCaseVariants() {
        Schema schema = TestFixtures.contactSchema();

        ResolvedField resolved = resolver.resolveFieldWithCommonAliases(schema, "fullName").orElseThrow();

        assertThat(resolved.getFieldKey()).isEqualTo("full_name");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.ALIAS);
    }

    @Test
    void fuzzyMatchIsTriedBeforeTypeMatch() {
        Schema schema = schemaOf(
                field("f1", "total", "Total", FieldType.NUMBER),
                field("f2", "amount_due", "Amount Due", FieldType.NUMBER));
        FieldQuery query = FieldQuery.builder().name("due").type(FieldType.NUMBER).build();

        ResolvedField resolved = resolver.resolveField(schema, query).orElseThrow();

        assertThat(resolved.getFieldKey()).isEqualTo("amount_due");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.FUZZY);
        assertThat(resolved.getConfidence()).isEqualTo(0.6);
    }

    @Test
    void typeMatchSkipsHiddenFields() {
        Schema schema = TestFixtures.contactSchema();
        FieldQuery query = FieldQuery.builder().name("zzz").type(FieldType.LONG_TEXT).build();

        assertThat(resolver.resolveField(schema, query)).isEmpty();

        FieldQuery currencyQuery = FieldQuery.builder().name("zzz").type(FieldType.CURRENCY).build();
        ResolvedField resolved = resolver.resolveField(schema, currencyQuery).orElseThrow();
        assertThat(resolved.getFieldKey()).isEqualTo("deal_value");
        assertThat(resolved.getMatchType()).isEqualTo(MatchType.TYPE);
    }

    @Test
    void missIsEmptyNotAnException() {
        Schema schema = TestFixtures.contactSchema();

        assertThat(resolver.resolveField(schema, "shipping_carrier")).isEmpty();
        assertThat(resolver.resolveField(schema, "")).isEmpty();
        assertThat(resolver.resolveField(schemaOf(), "email")).isEmpty();
    }

    @Test
    void resolvesMultipleReferencesInOrder() {
        Schema schema = TestFixtures.contactSchema();

        Map<String, Optional<ResolvedField>> results =
                resolver.resolveMultipleFields(schema, List.of("phone", "Full Name", "shipping_carrier"));

        assertThat(results).containsOnlyKeys("phone", "Full Name", "shipping_carrier");
        assertThat(results.keySet()).containsExactly("phone", "Full Name", "shipping_carrier");
        assertThat(results.get("phone")).isPresent();
        assertThat(results.get("Full Name").orElseThrow().getFieldKey()).isEqualTo("full_name");
        assertThat(results.get("shipping_carrier")).isEmpty();
    }

    // ===== record access =====

    @Test
    void readsNestedValueByDotPath() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("contact", new LinkedHashMap<>(Map.of("email", "a@b.com")));

        assertThat(resolver.getFieldValue(record, "contact.email")).contains("a@b.com");
    }

    @Test
    void doesNotFuzzIndividualPathSegments() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("contact", new LinkedHashMap<>(Map.of("email", "a@b.com")));

        assertThat(resolver.getFieldValue(record, "ContactEmail")).isEmpty();
    }

    @Test
    void retriesWholeReferenceCaseVariants() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("first_name", "Ada");
        record.put("lastName", "Lovelace");

        assertThat(resolver.getFieldValue(record, "firstName")).contains("Ada");
        assertThat(resolver.getFieldValue(record, "First Name")).contains("Ada");
        assertThat(resolver.getFieldValue(record, "last_name")).contains("Lovelace");
    }

    @Test
    void setFieldValueCreatesIntermediateContainers() {
        Map<String, Object> record = new LinkedHashMap<>();

        resolver.setFieldValue(record, "billing.address.city", "Lyon");

        assertThat(resolver.getFieldValue(record, "billing.address.city")).contains("Lyon");
    }

    @Test
    void setFieldValueRejectsScalarInPath() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("billing", "n/a");

        assertThatThrownBy(() -> resolver.setFieldValue(record, "billing.city", "Lyon"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("billing");
    }

    // ===== validation & mapping =====

    @Test
    void lowConfidenceReferenceIsInvalidWithSuggestions() {
        Schema schema = TestFixtures.contactSchema();

        FieldValidationResult result = resolver.validateFieldReference(schema, "email");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getSuggestions()).containsExactly("contact_email");
    }

    @Test
    void unrelatedReferenceSuggestsVisibleFields() {
        Schema schema = TestFixtures.contactSchema();

        FieldValidationResult result = resolver.validateFieldReference(schema, "shipping_carrier");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getSuggestions())
                .containsExactly("full_name", "contact_email", "phone", "deal_value");
    }

    @Test
    void exactReferenceIsValid() {
        FieldValidationResult result = resolver.validateFieldReference(TestFixtures.contactSchema(), "phone");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getField().getFieldId()).isEqualTo("f3");
    }

    @Test
    void mappingWarnsOnLossyTypes() {
        Schema source = schemaOf(field("s1", "notes", "Notes", FieldType.TEXT));
        Schema target = schemaOf(
                field("t1", "amount", "Amount", FieldType.NUMBER),
                field("t2", "summary", "Summary", FieldType.LONG_TEXT));

        FieldMappingResult lossy = resolver.createFieldMapping(source, target, "notes", "amount");
        FieldMappingResult widening = resolver.createFieldMapping(source, target, "notes", "summary");

        assertThat(lossy.isCompatible()).isTrue();
        assertThat(lossy.getWarnings()).hasSize(1);
        assertThat(lossy.getWarnings().get(0)).contains("Type mismatch");
        assertThat(widening.getWarnings()).isEmpty();
    }

    @Test
    void mappingWithMissingFieldIsIncompatible() {
        Schema source = schemaOf(field("s1", "notes", "Notes", FieldType.TEXT));
        Schema target = schemaOf(field("t1", "amount", "Amount", FieldType.NUMBER));

        FieldMappingResult result = resolver.createFieldMapping(source, target, "notes", "zzz");

        assertThat(result.isCompatible()).isFalse();
        assertThat(result.getTargetField()).isNull();
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("'zzz' not found"));
    }

    @Test
    void caseHelpers() {
        assertThat(FieldResolver.camelCase("contact_email")).isEqualTo("contactEmail");
        assertThat(FieldResolver.snakeCase("contactEmail")).isEqualTo("contact_email");
        assertThat(FieldResolver.kebabCase("Contact Email")).isEqualTo("contact-email");
    }

    private static SchemaField field(String id, String key, String label, FieldType type) {
        return SchemaField.builder().id(id).key(key).label(label).type(type).build();
    }

    private static Schema schemaOf(SchemaField... fields) {
        return Schema.builder()
                .id("schema-1")
                .name("Test")
                .fields(new ArrayList<>(List.of(fields)))
                .build();
    }
}
