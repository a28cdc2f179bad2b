package com.tenantseed.model;

import java.util.Optional;

/**
 * Result of a natural-key lookup: either {@code Found(id)} or {@code Absent}.
 */
public final class Lookup {

    private static final Lookup ABSENT = new Lookup(null);

    private final Long id;

    private Lookup(Long id) {
        this.id = id;
    }

    public static Lookup found(long id) {
        return new Lookup(id);
    }

    public static Lookup absent() {
        return ABSENT;
    }

    public static Lookup of(Optional<Long> id) {
        return id.map(Lookup::found).orElse(ABSENT);
    }

    public boolean isFound() {
        return id != null;
    }

    public long getId() {
        if (id == null) {
            throw new IllegalStateException("Lookup is absent");
        }
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lookup other = (Lookup) o;
        return id == null ? other.id == null : id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id == null ? 0 : id.hashCode();
    }

    @Override
    public String toString() {
        return id == null ? "Absent" : "Found(" + id + ")";
    }
}
