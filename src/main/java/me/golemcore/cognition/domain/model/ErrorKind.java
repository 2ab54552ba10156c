package me.golemcore.cognition.domain.model;

/**
 * Failure categories carried by {@link OperationResult}.
 */
public enum ErrorKind {
    /** Model timeout, network or storage I/O failure. Retry with backoff. */
    TRANSIENT_IO,
    /** Denied locally or reported by the provider. Never retried within a call. */
    RATE_LIMITED,
    /** Model output that does not match the expected structure. */
    PARSE,
    /** Heap above the high-water mark. */
    RESOURCE_PRESSURE,
    /** Unknown task kind, out-of-range value and the like. */
    INVARIANT_VIOLATION
}
