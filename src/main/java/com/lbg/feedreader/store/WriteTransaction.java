package com.lbg.feedreader.store;

import java.util.Optional;

/**
 * Handle passed to work running inside a read-write transaction.
 */
public interface WriteTransaction {

    Optional<WritableBucket> bucket(String name);
}
