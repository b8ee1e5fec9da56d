package com.recordplatform.schemashift.service.diff;

import com.recordplatform.schemashift.model.AffectedSystem;
import com.recordplatform.schemashift.model.AffectedSystemCategory;
import com.recordplatform.schemashift.model.SchemaChangeEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Category-level impact templates attached to events at diff time.
 * Counts are always 0 here; consumer validators measure the real numbers later.
 */
@Component
public class ImpactPredictor {

    public List<AffectedSystem> predict(SchemaChangeEvent event) {
        return switch (event.getChangeType()) {
            case FIELD_ADDED -> new ArrayList<>();
            case FIELD_RENAMED, FIELD_KEY_CHANGED -> fieldRenameImpact(event.getOldFieldKey(), event.getNewFieldKey());
            case FIELD_DELETED -> fieldDeletionImpact(event.getOldFieldKey());
            case FIELD_TYPE_CHANGED -> fieldTypeChangeImpact(event);
            case SCHEMA_RENAMED -> schemaRenameImpact();
        };
    }

    private List<AffectedSystem> fieldRenameImpact(String oldKey, String newKey) {
        List<AffectedSystem> affected = new ArrayList<>();
        // Workflows resolve references at run time
        affected.add(entry(AffectedSystemCategory.WORKFLOWS, false, true,
                "Field key changed from '" + oldKey + "' to '" + newKey + "'"));
        affected.add(entry(AffectedSystemCategory.INTEGRATIONS, true, false,
                "Integration field mappings may need update"));
        affected.add(entry(AffectedSystemCategory.STOREFRONT, false, true,
                "Product field mappings may need update"));
        return affected;
    }

    private List<AffectedSystem> fieldDeletionImpact(String fieldKey) {
        List<AffectedSystem> affected = new ArrayList<>();
        affected.add(entry(AffectedSystemCategory.WORKFLOWS, true, false,
                "Field '" + fieldKey + "' deleted - workflows may fail"));
        affected.add(entry(AffectedSystemCategory.INTEGRATIONS, true, false,
                "Field '" + fieldKey + "' deleted - mappings need review"));
        affected.add(entry(AffectedSystemCategory.STOREFRONT, true, false,
                "Field '" + fieldKey + "' deleted - product mappings need review"));
        affected.add(entry(AffectedSystemCategory.FORMS, true, false,
                "Field '" + fieldKey + "' deleted - forms may need update"));
        return affected;
    }

    private List<AffectedSystem> fieldTypeChangeImpact(SchemaChangeEvent event) {
        List<AffectedSystem> affected = new ArrayList<>();
        affected.add(entry(AffectedSystemCategory.WORKFLOWS, true, false,
                "Field type changed from '" + event.getOldFieldType() + "' to '" + event.getNewFieldType()
                        + "' - may affect data processing"));
        affected.add(entry(AffectedSystemCategory.API, true, false,
                "Field type change may affect API consumers"));
        return affected;
    }

    private List<AffectedSystem> schemaRenameImpact() {
        List<AffectedSystem> affected = new ArrayList<>();
        affected.add(entry(AffectedSystemCategory.STOREFRONT, false, true,
                "Product schema name changed"));
        affected.add(entry(AffectedSystemCategory.KNOWLEDGE_BASE, false, true,
                "Schema name in agent knowledge needs update"));
        // Forms and views reference the schema by id
        return affected;
    }

    private AffectedSystem entry(AffectedSystemCategory system, boolean requiresUserAction,
                                 boolean autoFixable, String details) {
        return AffectedSystem.builder()
                .system(system)
                .itemsAffected(0)
                .requiresUserAction(requiresUserAction)
                .autoFixable(autoFixable)
                .details(details)
                .build();
    }
}
