package com.lbg.feedreader.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every backing store implementation has to provide.
 */
abstract class BackingStoreContractTest {

    protected BackingStore store;

    protected abstract BackingStore createStore();

    @BeforeEach
    void setupStore() {
        store = createStore();
    }

    @Test
    void shouldReportMissingBucket() {
        assertTrue(store.read(tx -> tx.bucket("missing")).isEmpty());
        assertTrue(store.write(tx -> tx.bucket("missing")).isEmpty());
    }

    @Test
    void shouldCreateBucketOnce() {
        store.createBucketIfAbsent("feeds");
        put("feeds", "k", "v1");

        store.createBucketIfAbsent("feeds");

        assertEquals(Optional.of("v1"), get("feeds", "k"));
    }

    @Test
    void shouldReturnEmptyForAbsentKey() {
        store.createBucketIfAbsent("feeds");

        assertEquals(Optional.empty(), get("feeds", "nothing-here"));
    }

    @Test
    void shouldOverwriteValue() {
        store.createBucketIfAbsent("feeds");

        put("feeds", "k", "first");
        put("feeds", "k", "second");

        assertEquals(Optional.of("second"), get("feeds", "k"));
    }

    @Test
    void shouldKeepBucketsSeparate() {
        store.createBucketIfAbsent("a");
        store.createBucketIfAbsent("b");

        put("a", "k", "in-a");

        assertEquals(Optional.empty(), get("b", "k"));
    }

    @Test
    void shouldSeeOwnWritesInsideTransaction() {
        store.createBucketIfAbsent("feeds");

        String seen = store.write(tx -> {
            WritableBucket bucket = tx.bucket("feeds").orElseThrow();
            bucket.put("k", bytes("pending"));
            return bucket.get("k").map(BackingStoreContractTest::string).orElse(null);
        });

        assertEquals("pending", seen);
    }

    @Test
    void shouldRollBackWhenWorkFails() {
        store.createBucketIfAbsent("feeds");
        put("feeds", "k", "committed");

        assertThrows(IllegalStateException.class, () -> store.write(tx -> {
            tx.bucket("feeds").orElseThrow().put("k", bytes("discarded"));
            throw new IllegalStateException("boom");
        }));

        assertEquals(Optional.of("committed"), get("feeds", "k"));
    }

    private void put(String bucket, String key, String value) {
        store.write(tx -> {
            tx.bucket(bucket).orElseThrow().put(key, bytes(value));
            return null;
        });
    }

    private Optional<String> get(String bucket, String key) {
        return store.read(tx -> tx.bucket(bucket).orElseThrow().get(key).map(BackingStoreContractTest::string));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
