package com.lbg.feedreader.catalog;

/**
 * The store bucket is missing: the store was used before init, or the bucket was removed externally.
 */
public class UnconfiguredBucketException extends FeedStoreException {

    public UnconfiguredBucketException(String bucket) {
        super("Bucket `" + bucket + "` is unconfigured");
    }
}
