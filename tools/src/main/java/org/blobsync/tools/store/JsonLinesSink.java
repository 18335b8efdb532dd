// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.blobsync.tools.beacon.BeaconJson;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;
import org.blobsync.tools.sync.SlotWriteRecord;

/**
 * Appends one JSON line {@code {"slot":..,"data":[..]}} per record to a file. Existing lines are never touched. A
 * crash during a commit can leave the last line truncated.
 */
public final class JsonLinesSink implements PersistenceSink {
    /** Default file name inside the data directory. */
    public static final String DEFAULT_FILE_NAME = "blobs-data.jsonl";

    private final Path file;

    public JsonLinesSink(@NonNull Path file) {
        this.file = file;
    }

    @Override
    public void commit(@NonNull List<SlotWriteRecord> records) {
        final StringBuilder lines = new StringBuilder();
        for (SlotWriteRecord record : records) {
            lines.append(BeaconJson.GSON.toJson(new SlotLine(record.slot(), record.sidecars())))
                    .append('\n');
        }
        try {
            Files.writeString(
                    file,
                    lines,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            final long firstSlot = records.isEmpty() ? -1 : records.get(0).slot();
            throw new SyncException(Kind.SINK_COMMIT, firstSlot, "Failed to append to " + file, e);
        }
    }

    @Override
    public void close() {
        // each commit opens and closes the file
    }

    /** Shape of one line. */
    record SlotLine(long slot, List<BlobSidecar> data) {}
}
