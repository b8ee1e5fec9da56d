package com.recordplatform.schemashift.service.adapter;

import com.recordplatform.schemashift.dto.ChangeNotification;
import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.IntegrationFieldMapping;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import com.recordplatform.schemashift.model.SchemaChangeType;
import com.recordplatform.schemashift.repository.IntegrationFieldMappingRepository;
import com.recordplatform.schemashift.service.orchestration.ConsumerImpactValidator;
import com.recordplatform.schemashift.service.orchestration.NotificationSink;
import com.recordplatform.schemashift.service.orchestration.SchemaChangeAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps integration field mappings pointed at the right local field.
 *
 * A key change rewrites every rule on the old key. A deletion cannot be repaired
 * automatically: the rules are made read-only (sync stops for them) and the mapping is
 * flagged for review.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IntegrationMappingAdapter implements SchemaChangeAdapter, ConsumerImpactValidator {

    private final IntegrationFieldMappingRepository mappingRepository;
    private final NotificationSink notificationSink;
    private final Clock clock;

    @Override
    public String name() {
        return "integrations";
    }

    @Override
    public AffectedSystemCategory category() {
        return AffectedSystemCategory.INTEGRATIONS;
    }

    @Override
    public int countAffectedItems(SchemaChangeEvent event) {
        Set<String> keys = boundKeys(event);
        if (keys.isEmpty()) {
            return 0;
        }
        return (int) mappingsFor(event).stream()
                .filter(m -> m.getRules().stream().anyMatch(r -> keys.contains(r.getLocalField())))
                .count();
    }

    // A rename counts rules already moved to the new key as well
    static Set<String> boundKeys(SchemaChangeEvent event) {
        Set<String> keys = new HashSet<>();
        if (event.getOldFieldKey() != null) {
            keys.add(event.getOldFieldKey());
            SchemaChangeType type = event.getChangeType();
            if ((type == SchemaChangeType.FIELD_RENAMED || type == SchemaChangeType.FIELD_KEY_CHANGED)
                    && event.getNewFieldKey() != null) {
                keys.add(event.getNewFieldKey());
            }
        }
        return keys;
    }

    @Override
    public void adapt(SchemaChangeEvent event) {
        switch (event.getChangeType()) {
            case FIELD_RENAMED, FIELD_KEY_CHANGED -> rewriteLocalField(event);
            case FIELD_DELETED -> disableDeletedField(event);
            default -> {
                // no mapping changes
            }
        }
    }

    private void rewriteLocalField(SchemaChangeEvent event) {
        String oldKey = event.getOldFieldKey();
        String newKey = event.getNewFieldKey();
        if (oldKey == null || newKey == null || Objects.equals(oldKey, newKey)) {
            return;
        }

        for (IntegrationFieldMapping mapping : mappingsFor(event)) {
            int rewritten = 0;
            for (IntegrationFieldMapping.Rule rule : mapping.getRules()) {
                if (oldKey.equals(rule.getLocalField())) {
                    rule.setLocalField(newKey);
                    rewritten++;
                }
            }
            if (rewritten > 0) {
                mapping.setUpdatedAt(LocalDateTime.now(clock));
                mappingRepository.save(mapping);
                log.info("Integration {} mapping: {} rule(s) moved from '{}' to '{}'",
                        mapping.getIntegrationName(), rewritten, oldKey, newKey);
            }
        }
    }

    private void disableDeletedField(SchemaChangeEvent event) {
        String oldKey = event.getOldFieldKey();
        if (oldKey == null) {
            return;
        }

        for (IntegrationFieldMapping mapping : mappingsFor(event)) {
            List<IntegrationFieldMapping.Rule> broken = mapping.getRules().stream()
                    .filter(r -> oldKey.equals(r.getLocalField()) && !r.isReadonly())
                    .toList();
            if (broken.isEmpty()) {
                continue;
            }
            broken.forEach(r -> r.setReadonly(true));
            mapping.setNeedsReview(true);
            mapping.setUpdatedAt(LocalDateTime.now(clock));
            mappingRepository.save(mapping);

            log.warn("Integration {} mapping: sync disabled for {} rule(s) on deleted field '{}'",
                    mapping.getIntegrationName(), broken.size(), oldKey);
            recordReview(event, mapping, broken);
        }
    }

    private void recordReview(SchemaChangeEvent event, IntegrationFieldMapping mapping,
                              List<IntegrationFieldMapping.Rule> broken) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.getId());
        metadata.put("mappingId", mapping.getId());
        metadata.put("integrationId", mapping.getIntegrationId());
        metadata.put("externalFields", broken.stream().map(IntegrationFieldMapping.Rule::getExternalField).toList());

        notificationSink.recordDashboardEntry(ChangeNotification.builder()
                .organizationId(event.getOrganizationId())
                .title("Review " + mapping.getIntegrationName() + " field mapping")
                .message("Field '" + event.getOldFieldKey() + "' was deleted; sync is disabled for "
                        + broken.size() + " mapped field(s).")
                .type(ChangeNotification.Type.INTEGRATION_REVIEW)
                .severity("high")
                .blocking(false)
                .deliveryKey(event.getId() + ":" + mapping.getId())
                .actions(List.of(ChangeNotification.Action.REVIEW_MAPPING))
                .metadata(metadata)
                .build());
    }

    private List<IntegrationFieldMapping> mappingsFor(SchemaChangeEvent event) {
        return mappingRepository.findByOrganizationIdAndSchemaId(event.getOrganizationId(), event.getSchemaId());
    }
}
