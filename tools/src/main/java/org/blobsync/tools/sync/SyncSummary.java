// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Counts of what a run committed.
 *
 * @param windows committed windows
 * @param slots committed slot records
 * @param slotsWithBlobs committed slots that had at least one sidecar
 * @param sidecars committed sidecars
 */
public record SyncSummary(long windows, long slots, long slotsWithBlobs, long sidecars) {
    /** Nothing committed. */
    public static final SyncSummary EMPTY = new SyncSummary(0, 0, 0, 0);

    /**
     * @param records the records of one committed window
     * @return this summary with the window added
     */
    public SyncSummary plus(@NonNull List<SlotWriteRecord> records) {
        long withBlobs = 0;
        long sidecarCount = 0;
        for (SlotWriteRecord record : records) {
            if (!record.sidecars().isEmpty()) {
                withBlobs++;
                sidecarCount += record.sidecars().size();
            }
        }
        return new SyncSummary(
                windows + 1, slots + records.size(), slotsWithBlobs + withBlobs, sidecars + sidecarCount);
    }
}
