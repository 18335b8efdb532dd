// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.util.List;
import org.blobsync.tools.sync.SlotWriteRecord;

/**
 * Destination of committed windows.
 */
public interface PersistenceSink extends Closeable {

    /**
     * Persist the records of one window. Called with ascending slots, never concurrently.
     *
     * @param records the records of the window, ascending by slot
     * @throws org.blobsync.tools.common.SyncException {@code SINK_COMMIT} if the records could not be written, or
     *     {@code DECODE} if a record could not be converted to the storage format
     */
    void commit(@NonNull List<SlotWriteRecord> records);
}
