package com.tenantseed.exception;

import com.tenantseed.model.Handle;
import com.tenantseed.model.RefKind;

/**
 * A required cross-reference did not resolve. Builders skip the dependent record and warn.
 */
public class UnresolvedReferenceException extends RuntimeException {

    private final RefKind kind;
    private final Handle handle;

    public UnresolvedReferenceException(RefKind kind, Handle handle) {
        super("No " + kind + " found for " + handle);
        this.kind = kind;
        this.handle = handle;
    }

    public RefKind getKind() {
        return kind;
    }

    public Handle getHandle() {
        return handle;
    }
}
