package com.tenantseed.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Created/existing counters for one seeding run, threaded explicitly through every phase.
 */
public class SeedTally {

    private final Map<EntityKind, int[]> counts = new EnumMap<>(EntityKind.class);

    public void recordCreated(EntityKind kind) {
        slot(kind)[0]++;
    }

    public void recordExisting(EntityKind kind) {
        slot(kind)[1]++;
    }

    public int created(EntityKind kind) {
        int[] c = counts.get(kind);
        return c == null ? 0 : c[0];
    }

    public int existing(EntityKind kind) {
        int[] c = counts.get(kind);
        return c == null ? 0 : c[1];
    }

    public int totalCreated() {
        return counts.values().stream().mapToInt(c -> c[0]).sum();
    }

    public int totalExisting() {
        return counts.values().stream().mapToInt(c -> c[1]).sum();
    }

    private int[] slot(EntityKind kind) {
        return counts.computeIfAbsent(kind, k -> new int[2]);
    }
}
