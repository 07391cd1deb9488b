package com.dxobrettel.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable namespaced key to id store backed by a single SQLite file.
 *
 * <p>A connection is opened per call and closed right after, so the store can be
 * shared by the enrichment workers without extra locking. Writes are idempotent
 * upserts: two workers saving the same key converge on the same row.
 */
public class IdentifierCache {

    private static final Logger log = LoggerFactory.getLogger(IdentifierCache.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS cache (
                prefix    TEXT    NOT NULL,
                key       TEXT    NOT NULL,
                id        INTEGER NOT NULL,
                timestamp INTEGER NOT NULL,
                PRIMARY KEY (prefix, key)
            )
            """;

    private final Path dbFile;
    private final String dbUrl;
    private final Clock clock;

    public IdentifierCache(Path dbFile) {
        this(dbFile, Clock.systemUTC());
    }

    public IdentifierCache(Path dbFile, Clock clock) {
        this.dbFile = Objects.requireNonNull(dbFile, "dbFile");
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");
        initialize();
    }

    private void initialize() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory for " + dbFile, e);
        }
        try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
            log.debug("Identifier cache ready at {}", dbFile);
        } catch (SQLException e) {
            throw new IllegalStateException("Identifier cache initialization failed", e);
        }
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    public Path getDbFile() {
        return dbFile;
    }

    /**
     * Returns the stored id, or empty on a miss. Entries never expire through this overload.
     */
    public Optional<Long> get(String namespace, String key) {
        return get(namespace, key, null);
    }

    /**
     * Returns the stored id, or empty on a miss. When {@code timeout} is given and the
     * entry is older than it, the entry is evicted and the call reports a miss.
     */
    public Optional<Long> get(String namespace, String key, Duration timeout) {
        Optional<CacheEntry> entry = lookup(namespace, key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry found = entry.get();
        if (timeout != null && found.isExpired(clock.instant(), timeout)) {
            log.debug("Cache entry {}/{} expired, evicting", namespace, key);
            clear(namespace, key);
            return Optional.empty();
        }
        return Optional.of(found.value());
    }

    /**
     * Reads the full entry, timestamp included, without applying any expiry.
     */
    public Optional<CacheEntry> lookup(String namespace, String key) {
        requireText(namespace, "namespace");
        requireText(key, "key");
        String sql = "SELECT id, timestamp FROM cache WHERE prefix = ? AND key = ?";
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CacheEntry(namespace, key, rs.getLong(1), Instant.ofEpochMilli(rs.getLong(2))));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cache read failed for " + namespace + "/" + key, e);
        }
    }

    /**
     * Inserts or replaces the entry, stamped with the current time.
     */
    public void save(String namespace, String key, Long value) {
        requireText(namespace, "namespace");
        requireText(key, "key");
        Objects.requireNonNull(value, "value");
        String sql = "INSERT OR REPLACE INTO cache (prefix, key, id, timestamp) VALUES (?, ?, ?, ?)";
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setLong(3, value);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Cache write failed for " + namespace + "/" + key, e);
        }
    }

    /**
     * Drops every entry.
     */
    public int clear() {
        return delete("DELETE FROM cache");
    }

    /**
     * Drops every entry in one namespace.
     */
    public int clear(String namespace) {
        if (namespace == null) {
            return clear();
        }
        return delete("DELETE FROM cache WHERE prefix = ?", namespace);
    }

    /**
     * Drops a single entry. A null key widens the delete to the namespace, a null
     * namespace to the whole store.
     */
    public int clear(String namespace, String key) {
        if (namespace == null) {
            return clear();
        }
        if (key == null) {
            return clear(namespace);
        }
        return delete("DELETE FROM cache WHERE prefix = ? AND key = ?", namespace, key);
    }

    private int delete(String sql, String... params) {
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            int removed = ps.executeUpdate();
            log.debug("Removed {} cache entries", removed);
            return removed;
        } catch (SQLException e) {
            throw new IllegalStateException("Cache delete failed", e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
