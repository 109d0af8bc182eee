package com.stardust.core.repository;

/**
 * Storage-layer failure (write conflict, unreachable store). Kept apart from cryptographic
 * failures so callers can tell an unavailable store from unreadable data.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
