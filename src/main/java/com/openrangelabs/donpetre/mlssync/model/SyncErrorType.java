package com.openrangelabs.donpetre.mlssync.model;

/**
 * Classification of failures raised during a sync run.
 */
public enum SyncErrorType {
    AUTH,       // credential or token failure, aborts the run
    NETWORK,    // timeout or connection failure, retried with backoff
    API,        // non-2xx response or rate limit exceeded
    DATA,       // malformed or unmappable record, record skipped
    VALIDATION  // quality score below policy threshold
}
