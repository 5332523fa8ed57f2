package com.lbg.feedreader.store;

import io.quarkus.arc.properties.UnlessBuildProperty;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * H2-backed store. Buckets are rows of {@code kv_bucket}, entries are rows of
 * {@code kv_entry}; each read/write call maps onto one JDBC transaction.
 */
@Singleton
@UnlessBuildProperty(name = "feeds.store.backend", stringValue = "memory", enableIfMissing = true)
public class H2BackingStore implements BackingStore {

    private static final Logger LOG = Logger.getLogger(H2BackingStore.class);

    private static final String CREATE_BUCKET_TABLE =
            "CREATE TABLE IF NOT EXISTS kv_bucket (bucket_name VARCHAR(255) PRIMARY KEY)";
    private static final String CREATE_ENTRY_TABLE =
            "CREATE TABLE IF NOT EXISTS kv_entry ("
                    + "bucket_name VARCHAR(255) NOT NULL REFERENCES kv_bucket(bucket_name), "
                    + "entry_key VARCHAR(255) NOT NULL, "
                    + "entry_value BLOB, "
                    + "PRIMARY KEY (bucket_name, entry_key))";
    private static final String MERGE_BUCKET =
            "MERGE INTO kv_bucket (bucket_name) KEY (bucket_name) VALUES (?)";
    private static final String SELECT_BUCKET =
            "SELECT 1 FROM kv_bucket WHERE bucket_name = ?";
    private static final String SELECT_ENTRY =
            "SELECT entry_value FROM kv_entry WHERE bucket_name = ? AND entry_key = ?";
    private static final String MERGE_ENTRY =
            "MERGE INTO kv_entry (bucket_name, entry_key, entry_value) KEY (bucket_name, entry_key) VALUES (?, ?, ?)";

    private final DataSource dataSource;

    public H2BackingStore(DataSource dataSource) {
        this.dataSource = dataSource;
        createSchema();
    }

    @Override
    public void createBucketIfAbsent(String bucket) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(MERGE_BUCKET)) {
            stmt.setString(1, bucket);
            stmt.executeUpdate();
            LOG.debugf("Bucket ready: %s", bucket);
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to create bucket " + bucket, e);
        }
    }

    @Override
    public <T> T read(TransactionWork<ReadTransaction, T> work) {
        return inTransaction(true, connection ->
                work.apply(name -> bucketExists(connection, name)
                        ? Optional.<Bucket>of(new JdbcBucket(connection, name))
                        : Optional.empty()));
    }

    @Override
    public <T> T write(TransactionWork<WriteTransaction, T> work) {
        return inTransaction(false, connection ->
                work.apply(name -> bucketExists(connection, name)
                        ? Optional.<WritableBucket>of(new JdbcBucket(connection, name))
                        : Optional.empty()));
    }

    private <T> T inTransaction(boolean readOnly, TransactionWork<Connection, T> work) {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            connection.setReadOnly(readOnly);
            RuntimeException failure = null;
            boolean settled = false;
            try {
                T result = work.apply(connection);
                connection.commit();
                settled = true;
                return result;
            } catch (RuntimeException e) {
                failure = e;
                try {
                    connection.rollback();
                    settled = true;
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                // Switching auto-commit back on would commit a transaction that failed to roll back
                if (settled) {
                    try {
                        connection.setReadOnly(false);
                        connection.setAutoCommit(autoCommit);
                    } catch (SQLException resetFailure) {
                        if (failure == null) {
                            throw resetFailure;
                        }
                        failure.addSuppressed(resetFailure);
                    }
                }
            }
        } catch (SQLException e) {
            throw new BackingStoreException("Transaction failed", e);
        }
    }

    private void createSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute(CREATE_BUCKET_TABLE);
            stmt.execute(CREATE_ENTRY_TABLE);
            LOG.info("Backing store schema ready");
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to create backing store schema", e);
        }
    }

    private static boolean bucketExists(Connection connection, String bucket) {
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_BUCKET)) {
            stmt.setString(1, bucket);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to look up bucket " + bucket, e);
        }
    }

    private record JdbcBucket(Connection connection, String name) implements WritableBucket {

        @Override
        public Optional<byte[]> get(String key) {
            try (PreparedStatement stmt = connection.prepareStatement(SELECT_ENTRY)) {
                stmt.setString(1, name);
                stmt.setString(2, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.ofNullable(rs.getBytes(1)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new BackingStoreException("Failed to read " + name + "/" + key, e);
            }
        }

        @Override
        public void put(String key, byte[] value) {
            try (PreparedStatement stmt = connection.prepareStatement(MERGE_ENTRY)) {
                stmt.setString(1, name);
                stmt.setString(2, key);
                stmt.setBytes(3, value);
                stmt.executeUpdate();
                LOG.debugf("Wrote %d bytes to %s/%s", value.length, name, key);
            } catch (SQLException e) {
                throw new BackingStoreException("Failed to write " + name + "/" + key, e);
            }
        }
    }
}
