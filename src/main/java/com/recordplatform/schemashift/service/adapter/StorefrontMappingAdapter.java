package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.model.StorefrontMapping;
import com.recordplatform.schemashift.repository.StorefrontMappingRepository;
import com.recordplatform.schemashift.service.orchestration.ConsumerImpactValidator;
import com.recordplatform.schemashift.service.orchestration.NotificationSink;
import com.recordplatform.schemashift.service.orchestration.SchemaChangeAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps storefront product-role bindings in step with the catalog schema.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StorefrontMappingAdapter implements SchemaChangeAdapter, ConsumerImpactValidator {

    private final StorefrontMappingRepository mappingRepository;
    private final NotificationSink notificationSink;
    private final Clock clock;

    @Override
    public String name() {
        return "storefront";
    }

    @Override
    public AffectedSystemCategory category() {
        return AffectedSystemCategory.STOREFRONT;
    }

    @Override
    public int countAffectedItems(SchemaChangeEvent event) {
        List<StorefrontMapping> mappings = mappingsFor(event);
        if (event.getChangeType() == SchemaChangeType.SCHEMA_RENAMED) {
            return (int) mappings.stream()
                    .filter(m -> !Objects.equals(m.getSchemaName(), event.getNewSchemaName()))
                    .count();
        }
        Set<String> keys = IntegrationMappingAdapter.boundKeys(event);
        return (int) mappings.stream()
                .filter(m -> m.getFieldBindings().values().stream().anyMatch(keys::contains))
                .count();
    }

    @Override
    public void adapt(SchemaChangeEvent event) {
        switch (event.getChangeType()) {
            case FIELD_RENAMED, FIELD_KEY_CHANGED -> rebindKey(event);
            case FIELD_DELETED -> flagDeletedBindings(event);
            case SCHEMA_RENAMED -> refreshSchemaName(event);
            default -> {
                // bindings unaffected
            }
        }
    }

    private void rebindKey(SchemaChangeEvent event) {
        String oldKey = event.getOldFieldKey();
        String newKey = event.getNewFieldKey();
        if (oldKey == null || newKey == null || Objects.equals(oldKey, newKey)) {
            return;
        }
        for (StorefrontMapping mapping : mappingsFor(event)) {
            List<String> roles = rolesBoundTo(mapping, oldKey);
            if (roles.isEmpty()) {
                continue;
            }
            roles.forEach(role -> mapping.getFieldBindings().put(role, newKey));
            touch(mapping);
            log.info("Storefront mapping {}: role(s) {} rebound from '{}' to '{}'",
                    mapping.getId(), roles, oldKey, newKey);
        }
    }

    private void flagDeletedBindings(SchemaChangeEvent event) {
        String oldKey = event.getOldFieldKey();
        if (oldKey == null) {
            return;
        }
        for (StorefrontMapping mapping : mappingsFor(event)) {
            List<String> notes = new ArrayList<>();
            for (String role : rolesBoundTo(mapping, oldKey)) {
                String note = "Role '" + role + "' is bound to deleted field '" + oldKey + "'";
                if (!mapping.getReviewNotes().contains(note)) {
                    notes.add(note);
                }
            }
            if (notes.isEmpty()) {
                continue;
            }
            mapping.getReviewNotes().addAll(notes);
            mapping.setNeedsReview(true);
            touch(mapping);
            log.warn("Storefront mapping {} flagged for review: {}", mapping.getId(), notes);
            recordReview(event, mapping, notes);
        }
    }

    private void refreshSchemaName(SchemaChangeEvent event) {
        for (StorefrontMapping mapping : mappingsFor(event)) {
            if (!Objects.equals(mapping.getSchemaName(), event.getNewSchemaName())) {
                mapping.setSchemaName(event.getNewSchemaName());
                touch(mapping);
            }
        }
    }

    private List<String> rolesBoundTo(StorefrontMapping mapping, String fieldKey) {
        return mapping.getFieldBindings().entrySet().stream()
                .filter(e -> fieldKey.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private void touch(StorefrontMapping mapping) {
        mapping.setUpdatedAt(LocalDateTime.now(clock));
        mappingRepository.save(mapping);
    }

    private void recordReview(SchemaChangeEvent event, StorefrontMapping mapping, List<String> notes) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.getId());
        metadata.put("mappingId", mapping.getId());
        metadata.put("notes", notes);

        notificationSink.recordDashboardEntry(ChangeNotification.builder()
                .organizationId(event.getOrganizationId())
                .title("Review storefront product mapping")
                .message(String.join("; ", notes))
                .type(ChangeNotification.Type.STOREFRONT_REVIEW)
                .severity("high")
                .blocking(false)
                .deliveryKey(event.getId() + ":" + mapping.getId())
                .actions(List.of(ChangeNotification.Action.REVIEW_MAPPING))
                .metadata(metadata)
                .build());
    }

    private List<StorefrontMapping> mappingsFor(SchemaChangeEvent event) {
        return mappingRepository.findByOrganizationIdAndSchemaId(event.getOrganizationId(), event.getSchemaId());
    }
}
