package com.lbg.feedreader.store;

import java.util.Optional;

/**
 * Handle passed to work running inside a read-only transaction.
 */
public interface ReadTransaction {

    /**
     * The named bucket, or empty when it has not been created.
     */
    Optional<Bucket> bucket(String name);
}
