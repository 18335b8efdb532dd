// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The available persistence sinks.
 */
public enum SinkType {
    /** Atomic batches into a SQLite key value store, {@code blobs_db.sqlite}. */
    STORE,
    /** Appended JSON lines, {@code blobs-data.jsonl}. */
    JSONL;

    /**
     * Open a sink of this type in a data directory, creating the directory if needed.
     *
     * @param dataDir the data directory
     * @return the open sink
     * @throws IOException if the directory or the store cannot be created
     */
    public PersistenceSink open(@NonNull Path dataDir) throws IOException {
        Files.createDirectories(dataDir);
        return switch (this) {
            case STORE -> new KeyedStoreSink(
                    SqliteKeyValueStore.open(dataDir.resolve(SqliteKeyValueStore.DEFAULT_FILE_NAME)));
            case JSONL -> new JsonLinesSink(dataDir.resolve(JsonLinesSink.DEFAULT_FILE_NAME));
        };
    }
}
