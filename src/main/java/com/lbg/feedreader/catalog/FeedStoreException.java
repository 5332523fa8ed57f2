package com.lbg.feedreader.catalog;

/**
 * Base failure of the feed list store.
 */
public class FeedStoreException extends RuntimeException {

    public FeedStoreException(String message) {
        super(message);
    }

    public FeedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
