package com.recordplatform.schemashift.service.resolver;

import com.recordplatform.schemashift.dto.resolver.ResolvedField;
import com.recordplatform.schemashift.model.Schema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Puts the {@link ResolverCache} in front of {@link FieldResolver} for callers that resolve
 * the same references over and over (workflow validation sweeps).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CachedFieldResolver {

    private final FieldResolver fieldResolver;
    private final ResolverCache resolverCache;

    /**
     * Resolve with common aliases, consulting the cache first. Misses are cached as well.
     */
    public Optional<ResolvedField> resolve(Schema schema, String reference) {
        if (schema.getId() == null) {
            return fieldResolver.resolveFieldWithCommonAliases(schema, reference);
        }
        Optional<ResolverCache.CachedResolution> cached = resolverCache.get(schema.getId(), reference);
        if (cached.isPresent()) {
            return cached.get().resolvedField();
        }
        Optional<ResolvedField> resolved = fieldResolver.resolveFieldWithCommonAliases(schema, reference);
        resolverCache.set(schema.getId(), reference, resolved);
        return resolved;
    }

    public void evictSchema(String schemaId) {
        resolverCache.clearSchema(schemaId);
    }
}
