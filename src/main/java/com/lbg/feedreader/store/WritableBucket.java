package com.lbg.feedreader.store;

public interface WritableBucket extends Bucket {

    /**
     * Replace the value stored under key. Visible to other transactions after commit.
     */
    void put(String key, byte[] value);
}
