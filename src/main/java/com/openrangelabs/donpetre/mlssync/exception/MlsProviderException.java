package com.openrangelabs.donpetre.mlssync.exception;

import com.openrangelabs.donpetre.mlssync.model.SyncErrorType;

import java.time.LocalDateTime;

/**
 * Failure talking to an upstream MLS provider.
 *
 * <p>Carries the error classification used by the orchestrator to decide
 * between retrying, skipping a record and aborting the run.
 */
public class MlsProviderException extends RuntimeException {

    private final SyncErrorType type;
    private final boolean retryable;
    private final LocalDateTime retryAfter;

    public MlsProviderException(SyncErrorType type, boolean retryable, String message) {
        this(type, retryable, message, null, null);
    }

    public MlsProviderException(SyncErrorType type, boolean retryable, String message, Throwable cause) {
        this(type, retryable, message, null, cause);
    }

    public MlsProviderException(SyncErrorType type, boolean retryable, String message,
                                LocalDateTime retryAfter, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public static MlsProviderException auth(String message) {
        return new MlsProviderException(SyncErrorType.AUTH, false, message);
    }

    public static MlsProviderException network(String message, Throwable cause) {
        return new MlsProviderException(SyncErrorType.NETWORK, true, message, cause);
    }

    public static MlsProviderException rateLimited(String message, LocalDateTime retryAfter) {
        return new MlsProviderException(SyncErrorType.API, true, message, retryAfter, null);
    }

    public static MlsProviderException data(String message, Throwable cause) {
        return new MlsProviderException(SyncErrorType.DATA, false, message, cause);
    }

    public SyncErrorType getType() {
        return type;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public LocalDateTime getRetryAfter() {
        return retryAfter;
    }
}
