package com.lbg.feedreader.store;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Simple in-memory backing store for development/testing.
 * Not persistent - state is lost on restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "feeds.store.backend", stringValue = "memory")
public class InMemoryBackingStore implements BackingStore {

    private final Map<String, Map<String, byte[]>> buckets = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void createBucketIfAbsent(String bucket) {
        lock.writeLock().lock();
        try {
            buckets.computeIfAbsent(bucket, name -> new ConcurrentHashMap<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T read(TransactionWork<ReadTransaction, T> work) {
        lock.readLock().lock();
        try {
            return work.apply(name -> Optional.ofNullable(buckets.get(name)).<Bucket>map(ReadOnlyBucket::new));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> T write(TransactionWork<WriteTransaction, T> work) {
        lock.writeLock().lock();
        try {
            Map<String, Map<String, byte[]>> staged = new HashMap<>();
            T result = work.apply(name -> Optional.ofNullable(buckets.get(name))
                    .<WritableBucket>map(entries -> new StagingBucket(entries, staged.computeIfAbsent(name, n -> new HashMap<>()))));

            // Commit: only reached when the work completed without throwing
            staged.forEach((name, puts) -> buckets.get(name).putAll(puts));
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record ReadOnlyBucket(Map<String, byte[]> entries) implements Bucket {
        @Override
        public Optional<byte[]> get(String key) {
            return Optional.ofNullable(entries.get(key)).map(byte[]::clone);
        }
    }

    private record StagingBucket(Map<String, byte[]> committed, Map<String, byte[]> pending)
            implements WritableBucket {

        @Override
        public Optional<byte[]> get(String key) {
            byte[] value = pending.containsKey(key) ? pending.get(key) : committed.get(key);
            return Optional.ofNullable(value).map(byte[]::clone);
        }

        @Override
        public void put(String key, byte[] value) {
            pending.put(key, value.clone());
        }
    }
}
