package com.tenantseed.exception;

import com.tenantseed.model.EntityKind;

/**
 * The same natural key was requested twice in one run with different attributes.
 */
public class NaturalKeyConflictException extends RuntimeException {

    public NaturalKeyConflictException(EntityKind kind, String naturalKey) {
        super(kind.label() + " '" + naturalKey + "' declared twice with different attributes");
    }
}
