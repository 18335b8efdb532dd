// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import static java.lang.System.Logger.Level.DEBUG;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;
import org.blobsync.tools.sync.SlotWriteRecord;

/**
 * Writes each window as one atomic batch into a {@link KeyValueStore}, keyed by block root.
 * <p>
 * A slot without a header has no root to key on and is skipped; such a slot cannot have sidecars either, and a
 * record that breaks that rule fails the commit.
 */
public final class KeyedStoreSink implements PersistenceSink {
    private static final System.Logger LOGGER = System.getLogger(KeyedStoreSink.class.getName());

    /** Column holding encoded sidecar lists keyed by block root. */
    public static final String BLOB_SIDECARS_COLUMN = "blob_sidecars";

    private final KeyValueStore store;

    /**
     * @param store the store, closed when this sink is closed
     */
    public KeyedStoreSink(@NonNull KeyValueStore store) {
        this.store = store;
    }

    @Override
    public void commit(@NonNull List<SlotWriteRecord> records) {
        final List<KeyValueOp> operations = toOperations(records);
        try {
            store.doAtomically(operations);
        } catch (IOException e) {
            final long firstSlot = records.isEmpty() ? -1 : records.get(0).slot();
            throw new SyncException(Kind.SINK_COMMIT, firstSlot, "Atomic batch write failed", e);
        }
        LOGGER.log(DEBUG, "Stored {0} of {1} slots", operations.size(), records.size());
    }

    /**
     * Convert records to store operations, one put per record with a root.
     *
     * @param records the records of a window
     * @return the operations in record order
     * @throws SyncException {@code DECODE} if a sidecar field cannot be encoded, {@code SINK_COMMIT} if a record
     *     has sidecars but no root
     */
    public static List<KeyValueOp> toOperations(@NonNull List<SlotWriteRecord> records) {
        final List<KeyValueOp> operations = new ArrayList<>(records.size());
        for (SlotWriteRecord record : records) {
            if (record.root().isEmpty()) {
                if (!record.sidecars().isEmpty()) {
                    throw new SyncException(
                            Kind.SINK_COMMIT,
                            record.slot(),
                            "Slot has %d sidecars but no block root".formatted(record.sidecars().size()));
                }
                continue;
            }
            final byte[] value;
            try {
                value = BlobSidecarCodec.encode(record.sidecars());
            } catch (IllegalArgumentException e) {
                throw new SyncException(Kind.DECODE, record.slot(), "Cannot encode sidecars: " + e.getMessage(), e);
            }
            operations.add(KeyValueOp.put(BLOB_SIDECARS_COLUMN, record.root().toBytes(), value));
        }
        return operations;
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
