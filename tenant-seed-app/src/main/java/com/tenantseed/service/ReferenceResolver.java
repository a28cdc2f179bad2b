package com.tenantseed.service;

import com.tenantseed.exception.UnresolvedReferenceException;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.RefKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns fixture handles into record ids for one seeding run.
 * <p>
 * Ids registered during the run live in an in-memory arena and are returned first. Anything
 * else falls back to the persistence lookup for the kind, and a hit there is cached in the
 * arena. Index handles are translated to named handles through the fixture lists registered
 * with {@link #indexFixtures}.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    /** Tenant id used for global kinds. */
    static final long GLOBAL = 0L;

    private final Map<RefKind, NaturalKeyLookup> lookups;
    private final Map<ArenaKey, Long> arena = new HashMap<>();
    private final Map<IndexKey, List<Handle>> indexes = new HashMap<>();

    public ReferenceResolver(Map<RefKind, NaturalKeyLookup> lookups) {
        this.lookups = Map.copyOf(lookups);
    }

    /**
     * Declares the ordered fixture list for a kind so that {@code Handle.indexed(i)} can be
     * translated to the i-th named handle.
     */
    public void indexFixtures(long tenantId, RefKind kind, List<Handle> namedHandles) {
        for (Handle handle : namedHandles) {
            if (handle.isIndexed()) {
                throw new IllegalArgumentException("Fixture index must list named handles: " + handle);
            }
        }
        indexes.put(new IndexKey(scopeOf(tenantId, kind), kind), List.copyOf(namedHandles));
    }

    public void register(long tenantId, RefKind kind, Handle handle, long id) {
        Optional<Handle> named = toNamed(tenantId, kind, handle);
        if (named.isEmpty()) {
            throw new IllegalArgumentException("Cannot register " + kind + " under unindexed handle " + handle);
        }
        arena.put(ArenaKey.of(scopeOf(tenantId, kind), kind, named.get()), id);
    }

    public Lookup resolve(long tenantId, RefKind kind, Handle handle) {
        Optional<Handle> named = toNamed(tenantId, kind, handle);
        if (named.isEmpty()) {
            return Lookup.absent();
        }
        long scope = scopeOf(tenantId, kind);
        ArenaKey key = ArenaKey.of(scope, kind, named.get());
        Long cached = arena.get(key);
        if (cached != null) {
            return Lookup.found(cached);
        }

        NaturalKeyLookup lookup = lookups.get(kind);
        if (lookup == null) {
            return Lookup.absent();
        }
        Optional<Long> stored = lookup.find(scope, named.get().scope(), named.get().key());
        stored.ifPresent(id -> {
            log.debug("Resolved {} {} from store: {}", kind, named.get(), id);
            arena.put(key, id);
        });
        return Lookup.of(stored);
    }

    /**
     * @throws UnresolvedReferenceException if the handle does not resolve
     */
    public long require(long tenantId, RefKind kind, Handle handle) {
        Lookup lookup = resolve(tenantId, kind, handle);
        if (!lookup.isFound()) {
            throw new UnresolvedReferenceException(kind, handle);
        }
        return lookup.getId();
    }

    private Optional<Handle> toNamed(long tenantId, RefKind kind, Handle handle) {
        if (!handle.isIndexed()) {
            return Optional.of(handle);
        }
        List<Handle> fixtures = indexes.get(new IndexKey(scopeOf(tenantId, kind), kind));
        if (fixtures == null || handle.index() >= fixtures.size()) {
            return Optional.empty();
        }
        return Optional.of(fixtures.get(handle.index()));
    }

    private static long scopeOf(long tenantId, RefKind kind) {
        return kind.isGlobal() ? GLOBAL : tenantId;
    }

    private record ArenaKey(long tenantId, RefKind kind, String scope, String key) {
        static ArenaKey of(long tenantId, RefKind kind, Handle handle) {
            return new ArenaKey(tenantId, kind, handle.scope(), handle.key());
        }
    }

    private record IndexKey(long tenantId, RefKind kind) {
    }
}
