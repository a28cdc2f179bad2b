package com.tenantseed.model;

import java.util.Objects;

/**
 * Human-readable pointer to a previously created record: either a natural-key string
 * (optionally scoped, e.g. by species) or a zero-based index into a tenant's fixture list.
 */
public record Handle(String scope, String key, Integer index) {

    public Handle {
        if ((key == null) == (index == null)) {
            throw new IllegalArgumentException("A handle is either named or indexed");
        }
    }

    public static Handle named(String key) {
        return new Handle(null, Objects.requireNonNull(key, "key"), null);
    }

    public static Handle named(String scope, String key) {
        return new Handle(scope, Objects.requireNonNull(key, "key"), null);
    }

    public static Handle indexed(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative fixture index: " + index);
        }
        return new Handle(null, null, index);
    }

    public boolean isIndexed() {
        return index != null;
    }

    @Override
    public String toString() {
        if (isIndexed()) {
            return "#" + index;
        }
        return scope == null ? "'" + key + "'" : scope + " '" + key + "'";
    }
}
