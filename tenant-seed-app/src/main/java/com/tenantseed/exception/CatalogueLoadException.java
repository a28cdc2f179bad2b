package com.tenantseed.exception;

public class CatalogueLoadException extends RuntimeException {

    public CatalogueLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
