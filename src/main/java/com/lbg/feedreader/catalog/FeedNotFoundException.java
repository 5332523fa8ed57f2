package com.lbg.feedreader.catalog;

/**
 * No feed, default or stored, carries the requested id.
 */
public class FeedNotFoundException extends FeedStoreException {

    private final String feedId;

    public FeedNotFoundException(String feedId) {
        super("Feed does not exist: " + feedId);
        this.feedId = feedId;
    }

    public String feedId() {
        return feedId;
    }
}
