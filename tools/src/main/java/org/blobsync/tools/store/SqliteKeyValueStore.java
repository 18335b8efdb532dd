// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} in a single SQLite database file. Every key lives in table {@code kv} under its column;
 * a batch is one transaction, so SQLite's journal makes it all or nothing across crashes.
 * <p>
 * Holds one connection. Not meant for concurrent writers.
 */
public final class SqliteKeyValueStore implements KeyValueStore {
    private static final System.Logger LOGGER = System.getLogger(SqliteKeyValueStore.class.getName());

    /** Default file name inside the data directory. */
    public static final String DEFAULT_FILE_NAME = "blobs_db.sqlite";

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS kv (col TEXT NOT NULL, key BLOB NOT NULL, value BLOB NOT NULL,"
                    + " PRIMARY KEY (col, key))";
    private static final String PUT = "INSERT OR REPLACE INTO kv (col, key, value) VALUES (?, ?, ?)";
    private static final String GET = "SELECT value FROM kv WHERE col = ? AND key = ?";

    private final Path dbFile;
    private final Connection connection;

    private SqliteKeyValueStore(Path dbFile, Connection connection) {
        this.dbFile = dbFile;
        this.connection = connection;
    }

    /**
     * Open or create a store.
     *
     * @param dbFile the database file, created if missing
     * @return the open store
     * @throws IOException if the database cannot be opened or initialised
     */
    public static SqliteKeyValueStore open(@NonNull Path dbFile) throws IOException {
        final String url = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        Connection connection = null;
        try {
            connection = DriverManager.getConnection(url);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=WAL");
                statement.execute("PRAGMA synchronous=FULL");
                statement.execute(CREATE_TABLE);
            }
            connection.setAutoCommit(false);
            LOGGER.log(INFO, "Opened key value store {0}", dbFile);
            return new SqliteKeyValueStore(dbFile, connection);
        } catch (SQLException e) {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new IOException("Cannot open SQLite store " + dbFile, e);
        }
    }

    @Override
    public void doAtomically(@NonNull List<KeyValueOp> operations) throws IOException {
        if (operations.isEmpty()) {
            return;
        }
        try (PreparedStatement put = connection.prepareStatement(PUT)) {
            for (KeyValueOp op : operations) {
                put.setString(1, op.column());
                put.setBytes(2, op.key());
                put.setBytes(3, op.value());
                put.addBatch();
            }
            put.executeBatch();
            connection.commit();
            LOGGER.log(DEBUG, "Committed batch of {0} operations to {1}", operations.size(), dbFile);
        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new IOException("Atomic batch of %d operations failed".formatted(operations.size()), e);
        }
    }

    @Override
    public Optional<byte[]> get(@NonNull String column, @NonNull byte[] key) throws IOException {
        try (PreparedStatement get = connection.prepareStatement(GET)) {
            get.setString(1, column);
            get.setBytes(2, key);
            try (ResultSet resultSet = get.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getBytes(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Read from " + dbFile + " failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Cannot close SQLite store " + dbFile, e);
        }
    }
}
