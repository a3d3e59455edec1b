package com.weft.discovery.store;

/**
 * Thrown when the discovery store cannot read or write (SQL failure, JSON column encoding).
 * The discovery index catches it at its boundary and degrades to an empty result.
 */
public final class DiscoveryStoreException extends RuntimeException {

    private final String operation;

    public DiscoveryStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Store operation that failed (e.g. {@code replacePlugin}). */
    public String getOperation() {
        return operation;
    }
}
