package com.tenantseed.service;

import com.tenantseed.exception.NaturalKeyConflictException;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.SeedTally;
import com.tenantseed.model.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Create-if-absent for one natural key.
 * <p>
 * The finder runs first; when it finds nothing the creator runs inside a single transaction, so
 * every sub-record it writes commits together or not at all. Each outcome is counted in the
 * run's tally.
 * <p>
 * Within one run a natural key may be requested more than once, but only with the same
 * attributes. A second request with different attributes raises
 * {@link NaturalKeyConflictException} rather than keeping either version.
 */
public class IdempotentUpsert {

    private static final Logger log = LoggerFactory.getLogger(IdempotentUpsert.class);

    private final TransactionTemplate transactionTemplate;
    private final SeedTally tally;
    private final Map<FingerprintKey, Object> fingerprints = new HashMap<>();

    public IdempotentUpsert(TransactionTemplate transactionTemplate, SeedTally tally) {
        this.transactionTemplate = transactionTemplate;
        this.tally = tally;
    }

    /**
     * @param kind       what is being created, for the tally and the console
     * @param tenantId   owning tenant, or null for global records
     * @param naturalKey human-readable natural key
     * @param attributes value compared with {@code equals} against earlier requests for the same key
     * @param finder     looks the record up by natural key
     * @param creator    writes the record and its owned sub-records, returning the new id
     */
    public UpsertResult upsert(EntityKind kind, Long tenantId, String naturalKey, Object attributes,
                               Supplier<Lookup> finder, LongSupplier creator) {
        FingerprintKey fingerprintKey = new FingerprintKey(kind, tenantId, naturalKey);
        if (fingerprints.containsKey(fingerprintKey)
                && !Objects.equals(fingerprints.get(fingerprintKey), attributes)) {
            throw new NaturalKeyConflictException(kind, naturalKey);
        }
        fingerprints.put(fingerprintKey, attributes);

        Lookup existing = finder.get();
        if (existing.isFound()) {
            tally.recordExisting(kind);
            log.info("  = {} exists: {}", kind.label(), naturalKey);
            return new UpsertResult(existing.getId(), false);
        }

        Long id = transactionTemplate.execute(status -> creator.getAsLong());
        if (id == null) {
            throw new IllegalStateException("Creator returned no id for " + kind.label() + " " + naturalKey);
        }
        tally.recordCreated(kind);
        log.info("  + Created {}: {}", kind.label(), naturalKey);
        return new UpsertResult(id, true);
    }

    /**
     * Runs a multi-statement change that is not a plain create, such as a backfill, in one transaction.
     */
    public <T> T atomically(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    public SeedTally tally() {
        return tally;
    }

    private record FingerprintKey(EntityKind kind, Long tenantId, String naturalKey) {
    }
}
