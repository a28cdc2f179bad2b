package com.tenantseed.exception;

/**
 * A declared sire or dam could not be resolved even though generation ordering should have
 * created it first. Indicates broken fixture data; fatal for the tenant.
 */
public class UnresolvedLineageException extends RuntimeException {

    public UnresolvedLineageException(String animalName, String parentRole, String parentRef) {
        super("Animal '" + animalName + "' declares " + parentRole + " '" + parentRef
            + "' which was not created before it");
    }
}
