package com.lbg.feedreader.catalog;

/**
 * The persisted feed list could not be read back as a list of feeds.
 * The stored bytes are left untouched.
 */
public class CorruptedStoreException extends FeedStoreException {

    public CorruptedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
