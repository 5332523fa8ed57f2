package com.lbg.feedreader.store;

/**
 * Transactional key-value store organised in named buckets.
 * Each {@code read}/{@code write} call runs its work inside one transaction; a write
 * transaction commits when the work returns and rolls back when it throws.
 */
public interface BackingStore {

    /**
     * Create the bucket unless it already exists.
     */
    void createBucketIfAbsent(String bucket);

    /**
     * Run work inside a read-only transaction.
     */
    <T> T read(TransactionWork<ReadTransaction, T> work);

    /**
     * Run work inside a read-write transaction.
     */
    <T> T write(TransactionWork<WriteTransaction, T> work);

    @FunctionalInterface
    interface TransactionWork<X, T> {
        T apply(X tx);
    }
}
