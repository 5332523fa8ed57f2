package com.lbg.feedreader.store;

import java.util.Optional;

/**
 * Read view of one named bucket inside a transaction.
 */
public interface Bucket {

    Optional<byte[]> get(String key);
}
