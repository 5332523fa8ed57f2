package com.lbg.feedreader.catalog;

/**
 * The store bucket could not be created at startup. The store must not be used afterwards.
 */
public class InitializationException extends FeedStoreException {

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
