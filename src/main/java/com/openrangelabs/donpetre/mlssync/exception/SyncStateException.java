package com.openrangelabs.donpetre.mlssync.exception;

/**
 * Thrown when an operation is not allowed in the current state of a run,
 * error or candidate (for example stopping a run that is not running).
 */
public class SyncStateException extends RuntimeException {

    public SyncStateException(String message) {
        super(message);
    }
}
