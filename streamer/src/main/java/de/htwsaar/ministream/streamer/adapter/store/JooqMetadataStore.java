package de.htwsaar.ministream.streamer.adapter.store;

import de.htwsaar.ministream.streamer.domain.MetadataStore;
import de.htwsaar.ministream.streamer.domain.MetadataStoreException;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jOOQ-basierter {@link MetadataStore} auf SQLite.
 *
 * <p>Tabelle {@code session_metadata(session_key TEXT PRIMARY KEY, metadata BLOB, stored_at INTEGER)}.
 * SQLite-Verbindungen sind nicht für parallele Nutzung gedacht, daher sind alle Zugriffe synchronisiert.</p>
 */
public class JooqMetadataStore implements MetadataStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JooqMetadataStore.class);

    static final Table<Record> SESSION_METADATA = DSL.table(DSL.name("session_metadata"));
    static final Field<String> SESSION_KEY = DSL.field(DSL.name("session_key"), SQLDataType.VARCHAR);
    static final Field<byte[]> METADATA = DSL.field(DSL.name("metadata"), SQLDataType.BLOB);
    static final Field<Long> STORED_AT = DSL.field(DSL.name("stored_at"), SQLDataType.BIGINT);

    private final DSLContext dsl;
    private final Clock clock;
    private final Connection connection;

    public JooqMetadataStore(String jdbcUrl, Clock clock) throws SQLException {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        createParentDirectory(jdbcUrl);
        this.connection = DriverManager.getConnection(jdbcUrl);
        this.dsl = DSL.using(connection, SQLDialect.SQLITE);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        initializeSchema();
    }

    @Override
    public synchronized Optional<byte[]> get(SessionKey key) {
        try {
            return dsl.select(METADATA)
                    .from(SESSION_METADATA)
                    .where(SESSION_KEY.eq(key.hex()))
                    .fetchOptional(METADATA);
        } catch (DataAccessException ex) {
            throw new MetadataStoreException("Failed to read metadata of " + key, ex);
        }
    }

    @Override
    public synchronized void put(SessionKey key, byte[] metadata) {
        long now = clock.millis();
        try {
            dsl.insertInto(SESSION_METADATA)
                    .columns(SESSION_KEY, METADATA, STORED_AT)
                    .values(key.hex(), metadata, now)
                    .onConflict(SESSION_KEY)
                    .doUpdate()
                    .set(METADATA, metadata)
                    .set(STORED_AT, now)
                    .execute();
        } catch (DataAccessException ex) {
            throw new MetadataStoreException("Failed to store metadata of " + key, ex);
        }
    }

    @Override
    public synchronized void delete(SessionKey key) {
        try {
            dsl.deleteFrom(SESSION_METADATA).where(SESSION_KEY.eq(key.hex())).execute();
        } catch (DataAccessException ex) {
            throw new MetadataStoreException("Failed to delete metadata of " + key, ex);
        }
    }

    public synchronized int count() {
        return dsl.fetchCount(SESSION_METADATA);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            log.warn("Closing metadata store connection failed: {}", ex.getMessage());
        }
    }

    private void initializeSchema() {
        dsl.createTableIfNotExists(SESSION_METADATA)
                .column(SESSION_KEY, SQLDataType.VARCHAR.nullable(false))
                .column(METADATA, SQLDataType.BLOB.nullable(false))
                .column(STORED_AT, SQLDataType.BIGINT.nullable(false))
                .primaryKey(SESSION_KEY)
                .execute();
    }

    private static void createParentDirectory(String jdbcUrl) {
        String prefix = "jdbc:sqlite:";
        if (!jdbcUrl.startsWith(prefix)) return;
        String location = jdbcUrl.substring(prefix.length());
        int query = location.indexOf('?');
        if (query >= 0) location = location.substring(0, query);
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) return;
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new MetadataStoreException("Cannot create directory for " + jdbcUrl, ex);
        }
    }
}
