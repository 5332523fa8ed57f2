package com.lbg.feedreader.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.lbg.feedreader.domain.DefaultCatalog;
import com.lbg.feedreader.domain.Feed;
import com.lbg.feedreader.store.BackingStore;
import com.lbg.feedreader.store.BackingStoreException;
import com.lbg.feedreader.util.FeedIdentity;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps the feeds that can be queried for articles: the default catalog followed by
 * the feeds users registered, which live as one JSON array in the backing store.
 *
 * <p>Registration is idempotent on URL. Adds are serialized behind a store-wide lock
 * because the duplicate check and the write run in separate transactions.
 */
@Singleton
public class FeedListStore {

    private static final Logger LOG = Logger.getLogger(FeedListStore.class);

    static final String FEED_LIST_BUCKET = "feedlist";
    static final String ALL_FEEDS_KEY = "all";

    private static final TypeReference<List<Feed>> FEED_LIST = new TypeReference<>() {
    };

    private final BackingStore backingStore;
    private final DefaultCatalog defaultCatalog;
    private final ObjectMapper objectMapper;
    private final ObjectReader storedListReader;
    private final Supplier<String> idGenerator;
    private final ReentrantLock addLock = new ReentrantLock();

    @Inject
    public FeedListStore(BackingStore backingStore, DefaultCatalog defaultCatalog, ObjectMapper objectMapper) {
        this(backingStore, defaultCatalog, objectMapper, FeedIdentity::newId);
    }

    FeedListStore(BackingStore backingStore, DefaultCatalog defaultCatalog, ObjectMapper objectMapper,
                  Supplier<String> idGenerator) {
        this.backingStore = backingStore;
        this.defaultCatalog = defaultCatalog;
        this.objectMapper = objectMapper;
        this.storedListReader = strictListReader(objectMapper);
        this.idGenerator = idGenerator;
    }

    void onStart(@Observes StartupEvent event) {
        init();
    }

    /**
     * Ensure the feed list bucket exists. Safe to call more than once.
     */
    public void init() {
        try {
            backingStore.createBucketIfAbsent(FEED_LIST_BUCKET);
        } catch (BackingStoreException e) {
            LOG.errorf(e, "Error creating bucket %s", FEED_LIST_BUCKET);
            throw new InitializationException("Error initializing feed list store", e);
        }
        LOG.infof("Feed list store ready (%d default feeds)", defaultCatalog.size());
    }

    /**
     * All feeds: the default catalog first, then stored feeds in insertion order.
     */
    public List<Feed> listAll() {
        return merge(listStored());
    }

    private List<Feed> merge(List<Feed> stored) {
        List<Feed> all = new ArrayList<>(defaultCatalog.size() + stored.size());
        all.addAll(defaultCatalog.feeds());
        all.addAll(stored);
        return Collections.unmodifiableList(all);
    }

    public Feed getById(String id) {
        for (Feed feed : listAll()) {
            if (feed.id().equals(id)) {
                return feed;
            }
        }
        throw new FeedNotFoundException(id);
    }

    /**
     * Register a feed and return its id. The caller's id is always replaced; if a feed
     * with the same URL already exists, its id is returned and nothing is written.
     */
    public String add(Feed candidate) {
        Feed feed = candidate.withId(idGenerator.get());

        addLock.lock();
        try {
            List<Feed> stored = listStored();

            for (Feed existing : merge(stored)) {
                if (existing.url().equals(feed.url())) {
                    LOG.debugf("Feed %s already registered as %s", feed.url(), existing.id());
                    return existing.id();
                }
            }

            List<Feed> updated = new ArrayList<>(stored);
            updated.add(feed);
            writeStored(updated);

            LOG.infof("Added feed %s (%s)", feed.id(), feed.url());
            return feed.id();
        } finally {
            addLock.unlock();
        }
    }

    /**
     * Feeds registered through {@link #add(Feed)}, without the default catalog.
     */
    public List<Feed> listStored() {
        byte[] raw = backingStore.read(tx -> tx.bucket(FEED_LIST_BUCKET)
                .orElseThrow(FeedListStore::unconfigured)
                .get(ALL_FEEDS_KEY)
                .orElse(new byte[0]));

        if (raw.length == 0) {
            return List.of();
        }

        List<Feed> feeds;
        try {
            feeds = storedListReader.readValue(raw);
        } catch (IOException e) {
            LOG.errorf(e, "Can't read stored feed list (%d bytes)", raw.length);
            throw new CorruptedStoreException("Corrupted stored feed list", e);
        }

        if (feeds == null) {
            return List.of();
        }
        if (feeds.contains(null)) {
            LOG.errorf("Stored feed list has null entries (%d bytes)", raw.length);
            throw new CorruptedStoreException("Corrupted stored feed list", null);
        }
        return List.copyOf(feeds);
    }

    private void writeStored(List<Feed> feeds) {
        byte[] raw;
        try {
            raw = objectMapper.writeValueAsBytes(feeds);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize %d feeds", feeds.size());
            throw new FeedStoreException("Failed to serialize feed list", e);
        }

        backingStore.write(tx -> {
            tx.bucket(FEED_LIST_BUCKET)
                    .orElseThrow(FeedListStore::unconfigured)
                    .put(ALL_FEEDS_KEY, raw);
            return null;
        });
    }

    /**
     * Reader for the persisted list that accepts nothing but a JSON array of feed objects
     * with string fields, whatever the injected mapper is configured to tolerate.
     */
    private static ObjectReader strictListReader(ObjectMapper objectMapper) {
        ObjectMapper strict = objectMapper.copy();
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return strict.readerFor(FEED_LIST)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static UnconfiguredBucketException unconfigured() {
        LOG.errorf("Bucket `%s` is unconfigured", FEED_LIST_BUCKET);
        return new UnconfiguredBucketException(FEED_LIST_BUCKET);
    }
}
