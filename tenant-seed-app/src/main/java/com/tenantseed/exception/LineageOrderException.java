package com.tenantseed.exception;

/**
 * A parent declared in the same animal list does not carry a strictly lower generation than
 * its offspring.
 */
public class LineageOrderException extends RuntimeException {

    public LineageOrderException(String message) {
        super(message);
    }
}
