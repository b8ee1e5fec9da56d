package com.recordplatform.schemashift.service.resolver;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.recordplatform.schemashift.dto.resolver.ResolvedField;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-boxed memo of field resolutions, keyed by schema id and reference, backed by Caffeine.
 *
 * Negative results are cached too: a present {@link CachedResolution} with no field means
 * "resolved to nothing", while an empty lookup means the reference was never cached or
 * has expired. The cache never invalidates itself on schema writes; whoever mutates a
 * schema calls {@link #clearSchema(String)}.
 */
@Slf4j
public class ResolverCache {

    static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private static final String KEY_SEPARATOR = ":";

    private final Cache<String, CachedResolution> entries;

    public ResolverCache(Duration ttl, Clock clock) {
        this(ttl, DEFAULT_MAXIMUM_SIZE, clock);
    }

    public ResolverCache(Duration ttl, long maximumSize, Clock clock) {
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .build();
    }

    public Optional<CachedResolution> get(String schemaId, String reference) {
        return Optional.ofNullable(entries.getIfPresent(cacheKey(schemaId, reference)));
    }

    public void set(String schemaId, String reference, Optional<ResolvedField> resolved) {
        entries.put(cacheKey(schemaId, reference), new CachedResolution(resolved.orElse(null)));
    }

    public void clearSchema(String schemaId) {
        String prefix = schemaId + KEY_SEPARATOR;
        int before = size();
        entries.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("Evicted {} cached resolutions for schema {}", before - size(), schemaId);
    }

    public void clear() {
        entries.invalidateAll();
    }

    /**
     * Live entries only; expired ones are dropped first.
     */
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    private static String cacheKey(String schemaId, String reference) {
        return schemaId + KEY_SEPARATOR + reference;
    }

    // Expiry follows the injected clock so tests can move time
    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * One cache entry. {@code field} is null for a cached miss.
     */
    public record CachedResolution(ResolvedField field) {

        public Optional<ResolvedField> resolvedField() {
            return Optional.ofNullable(field);
        }

        public boolean isNegative() {
            return field == null;
        }
    }
}
