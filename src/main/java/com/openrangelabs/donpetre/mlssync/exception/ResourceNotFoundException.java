package com.openrangelabs.donpetre.mlssync.exception;

/**
 * Thrown when a provider, run, error or duplicate candidate does not exist
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
