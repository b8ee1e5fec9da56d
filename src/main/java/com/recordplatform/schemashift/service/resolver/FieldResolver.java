package com.recordplatform.schemashift.service.resolver;

import com.recordplatform.schemashift.dto.resolver.FieldMappingResult;
import com.recordplatform.schemashift.dto.resolver.FieldQuery;
import com.recordplatform.schemashift.dto.resolver.FieldValidationResult;
import com.recordplatform.schemashift.dto.resolver.ResolvedField;
import com.recordplatform.schemashift.dto.resolver.ResolvedField.MatchType;
import com.recordplatform.schemashift.model.FieldType;
import com.recordplatform.schemashift.model.Schema;
import com.recordplatform.schemashift.model.SchemaField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves loose field references against a schema snapshot.
 *
 * Resolution order, first hit wins:
 * 1. exact key (1.0)
 * 2. exact label (0.95)
 * 3. alias equal to a key or label (0.8)
 * 4. normalized substring match on key or label (0.6)
 * 5. first visible field of the requested type (0.5)
 *
 * A miss is an empty result, never an exception.
 */
@Component
@Slf4j
public class FieldResolver {

    public static final double VALID_CONFIDENCE = 0.8;

    private static final int MAX_SUGGESTIONS = 5;

    private static final Pattern SEPARATORS = Pattern.compile("[_\\s-]");
    private static final Pattern SEPARATOR_THEN_CHAR = Pattern.compile("[_\\s-](.)");
    private static final Pattern UPPERCASE = Pattern.compile("([A-Z])");

    private static final Map<String, List<String>> COMMON_ALIASES = buildAliasTable();

    // ========================= RESOLUTION =========================

    public Optional<ResolvedField> resolveField(Schema schema, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return resolveField(schema, FieldQuery.of(reference));
    }

    public Optional<ResolvedField> resolveField(Schema schema, FieldQuery query) {
        List<SchemaField> fields = fieldsOf(schema);
        if (fields.isEmpty() || query == null) {
            return Optional.empty();
        }

        if (hasText(query.getKey())) {
            Optional<SchemaField> match = fields.stream()
                    .filter(f -> query.getKey().equals(f.getKey()))
                    .findFirst();
            if (match.isPresent()) {
                return Optional.of(ResolvedField.of(match.get(), MatchType.EXACT_KEY));
            }
        }

        if (hasText(query.getName())) {
            Optional<SchemaField> match = fields.stream()
                    .filter(f -> query.getName().equals(f.getLabel()))
                    .findFirst();
            if (match.isPresent()) {
                return Optional.of(ResolvedField.of(match.get(), MatchType.EXACT_LABEL));
            }
        }

        if (query.getAliases() != null) {
            for (String alias : query.getAliases()) {
                Optional<SchemaField> match = fields.stream()
                        .filter(f -> alias.equals(f.getKey()) || alias.equals(f.getLabel()))
                        .findFirst();
                if (match.isPresent()) {
                    return Optional.of(ResolvedField.of(match.get(), MatchType.ALIAS));
                }
            }
        }

        String searchTerm = hasText(query.getName()) ? query.getName() : query.getKey();
        if (hasText(searchTerm)) {
            Optional<SchemaField> match = findByFuzzyMatch(fields, searchTerm);
            if (match.isPresent()) {
                return Optional.of(ResolvedField.of(match.get(), MatchType.FUZZY));
            }
        }

        if (query.getType() != null) {
            Optional<SchemaField> match = fields.stream()
                    .filter(f -> f.getType() == query.getType() && !f.isHidden())
                    .findFirst();
            if (match.isPresent()) {
                return Optional.of(ResolvedField.of(match.get(), MatchType.TYPE));
            }
        }

        log.debug("No field in schema {} matched query key='{}' name='{}'",
                schema.getId(), query.getKey(), query.getName());
        return Optional.empty();
    }

    /**
     * Resolve with the platform's alias table and the camel/snake/kebab variants of the reference.
     */
    public Optional<ResolvedField> resolveFieldWithCommonAliases(Schema schema, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        FieldQuery query = FieldQuery.builder()
                .name(reference)
                .key(reference)
                .aliases(commonAliases(reference))
                .build();
        return resolveField(schema, query);
    }

    public Map<String, Optional<ResolvedField>> resolveMultipleFields(Schema schema, List<String> references) {
        Map<String, Optional<ResolvedField>> results = new LinkedHashMap<>();
        for (String reference : references) {
            results.put(reference, resolveField(schema, reference));
        }
        return results;
    }

    // ========================= RECORD ACCESS =========================

    /**
     * Read a value by dot path. On a miss, retries the lowercase, camelCase and snake_case
     * forms of the whole reference; individual segments are never fuzzed.
     */
    public Optional<Object> getFieldValue(Map<String, Object> record, String reference) {
        if (record == null || !hasText(reference)) {
            return Optional.empty();
        }
        Optional<Object> direct = getNestedValue(record, reference);
        if (direct.isPresent()) {
            return direct;
        }
        for (String variation : List.of(reference.toLowerCase(), camelCase(reference), snakeCase(reference))) {
            Optional<Object> value = getNestedValue(record, variation);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public Optional<Object> getFieldValue(Map<String, Object> record, ResolvedField resolved) {
        if (record == null || resolved == null) {
            return Optional.empty();
        }
        return getNestedValue(record, resolved.getFieldKey());
    }

    public void setFieldValue(Map<String, Object> record, String reference, Object value) {
        if (!hasText(reference)) {
            return;
        }
        String[] keys = reference.split("\\.");
        Map<String, Object> current = record;
        for (int i = 0; i < keys.length - 1; i++) {
            Object next = current.get(keys[i]);
            if (next == null) {
                Map<String, Object> container = new LinkedHashMap<>();
                current.put(keys[i], container);
                current = container;
            } else if (next instanceof Map<?, ?> map) {
                current = castToRecord(map);
            } else {
                throw new IllegalArgumentException(
                        "Cannot write '" + reference + "': segment '" + keys[i] + "' holds a non-container value");
            }
        }
        current.put(keys[keys.length - 1], value);
    }

    public void setFieldValue(Map<String, Object> record, ResolvedField resolved, Object value) {
        setFieldValue(record, resolved.getFieldKey(), value);
    }

    // ========================= VALIDATION & MAPPING =========================

    public FieldValidationResult validateFieldReference(Schema schema, String reference) {
        Optional<ResolvedField> resolved = resolveField(schema, reference);
        if (resolved.isPresent() && resolved.get().getConfidence() >= VALID_CONFIDENCE) {
            return FieldValidationResult.builder()
                    .valid(true)
                    .field(resolved.get())
                    .build();
        }
        return FieldValidationResult.builder()
                .valid(false)
                .suggestions(generateSuggestions(schema, reference))
                .build();
    }

    public FieldMappingResult createFieldMapping(Schema sourceSchema, Schema targetSchema,
                                                 String sourceReference, String targetReference) {
        Optional<ResolvedField> source = resolveField(sourceSchema, sourceReference);
        Optional<ResolvedField> target = resolveField(targetSchema, targetReference);

        List<String> warnings = new ArrayList<>();
        boolean compatible = true;

        if (source.isEmpty()) {
            warnings.add("Source field '" + sourceReference + "' not found in schema '" + sourceSchema.getName() + "'");
            compatible = false;
        }
        if (target.isEmpty()) {
            warnings.add("Target field '" + targetReference + "' not found in schema '" + targetSchema.getName() + "'");
            compatible = false;
        }
        if (source.isPresent() && target.isPresent()) {
            FieldType from = source.get().getFieldType();
            FieldType to = target.get().getFieldType();
            if (from != null && to != null && !from.isCompatibleWith(to)) {
                warnings.add("Type mismatch: " + from + " -> " + to + " may lose data");
            }
        }

        return FieldMappingResult.builder()
                .sourceField(source.orElse(null))
                .targetField(target.orElse(null))
                .compatible(compatible)
                .warnings(warnings)
                .build();
    }

    // ========================= HELPERS =========================

    private Optional<SchemaField> findByFuzzyMatch(List<SchemaField> fields, String searchTerm) {
        String search = normalize(searchTerm);
        if (search.isEmpty()) {
            return Optional.empty();
        }
        return fields.stream()
                .filter(f -> {
                    String key = normalize(f.getKey());
                    String label = normalize(f.getLabel());
                    return (!key.isEmpty() && (key.contains(search) || search.contains(key)))
                            || (!label.isEmpty() && (label.contains(search) || search.contains(label)));
                })
                .findFirst();
    }

    private List<String> generateSuggestions(Schema schema, String reference) {
        List<SchemaField> fields = fieldsOf(schema);
        String needle = reference == null ? "" : reference.toLowerCase();

        List<String> similar = needle.isEmpty() ? List.of() : fields.stream()
                .filter(f -> {
                    String key = lower(f.getKey());
                    String label = lower(f.getLabel());
                    return (!key.isEmpty() && (key.contains(needle) || needle.contains(key)))
                            || (!label.isEmpty() && (label.contains(needle) || needle.contains(label)));
                })
                .map(SchemaField::getKey)
                .limit(MAX_SUGGESTIONS)
                .toList();
        if (!similar.isEmpty()) {
            return similar;
        }

        return fields.stream()
                .filter(f -> !f.isHidden())
                .map(SchemaField::getKey)
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    List<String> commonAliases(String reference) {
        Set<String> aliases = new LinkedHashSet<>();
        String normalized = reference.toLowerCase();
        COMMON_ALIASES.forEach((key, values) -> {
            if (normalized.contains(key) || key.contains(normalized)) {
                aliases.addAll(values);
            }
        });
        aliases.add(camelCase(reference));
        aliases.add(snakeCase(reference));
        aliases.add(kebabCase(reference));
        return new ArrayList<>(aliases);
    }

    private Optional<Object> getNestedValue(Map<String, Object> record, String path) {
        Object current = record;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> castToRecord(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    static String camelCase(String value) {
        Matcher matcher = SEPARATOR_THEN_CHAR.matcher(value.toLowerCase());
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1).toUpperCase()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String snakeCase(String value) {
        return separatorCase(value, "_");
    }

    static String kebabCase(String value) {
        return separatorCase(value, "-");
    }

    private static String separatorCase(String value, String separator) {
        String result = UPPERCASE.matcher(value).replaceAll(separator + "$1")
                .toLowerCase()
                .replaceAll("[_\\s-]+", separator);
        return result.startsWith(separator) ? result.substring(1) : result;
    }

    private static String normalize(String value) {
        return value == null ? "" : SEPARATORS.matcher(value.toLowerCase()).replaceAll("");
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static List<SchemaField> fieldsOf(Schema schema) {
        return schema == null || schema.getFields() == null ? List.of() : schema.getFields();
    }

    private static Map<String, List<String>> buildAliasTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("price", List.of("cost", "amount", "rate", "hourly_rate", "pricing", "value"));
        table.put("name", List.of("title", "product_name", "item_name", "display_name", "label"));
        table.put("description", List.of("desc", "details", "summary", "about", "info"));
        table.put("email", List.of("email_address", "contact_email", "e_mail"));
        table.put("phone", List.of("phone_number", "telephone", "contact_number", "mobile"));
        table.put("address", List.of("street_address", "location", "address_line_1"));
        table.put("company", List.of("company_name", "organization", "business", "employer"));
        table.put("website", List.of("url", "web_address", "site", "homepage"));
        table.put("status", List.of("state", "stage", "lifecycle_stage"));
        table.put("category", List.of("type", "classification", "group"));
        table.put("quantity", List.of("qty", "amount", "count", "stock"));
        table.put("sku", List.of("product_code", "item_code", "part_number"));
        table.put("image", List.of("images", "photo", "picture", "thumbnail"));
        table.put("date", List.of("created_at", "created_date", "timestamp"));
        return Collections.unmodifiableMap(table);
    }
}
