package com.lbg.feedreader.store;

/**
 * Failure of the underlying storage engine.
 */
public class BackingStoreException extends RuntimeException {

    public BackingStoreException(String message) {
        super(message);
    }

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
