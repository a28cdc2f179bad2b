package com.tenantseed.exception;

/**
 * Failure in a global pre-pass. Aborts the whole run.
 */
public class SeedSetupException extends RuntimeException {

    public SeedSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
