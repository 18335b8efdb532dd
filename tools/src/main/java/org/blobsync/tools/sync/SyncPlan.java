// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.blobsync.tools.common.SlotRange;

/**
 * The resolved work of a run.
 *
 * @param range the inclusive slot range to sync
 * @param windowSize the number of slots fetched concurrently per window
 */
public record SyncPlan(@NonNull SlotRange range, int windowSize) {

    public SyncPlan {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize: %d must be at least 1".formatted(windowSize));
        }
    }

    public List<SlotRange> windows() {
        return range.windows(windowSize);
    }

    /**
     * Completion of the run at the moment {@code window} is committed, measured from the start of the window as
     * in {@code (window.start - range.start) / (range.end - range.start) * 100}.
     *
     * @param window a window of this plan
     * @return the percentage, 0 for a single slot range
     */
    public double percentComplete(@NonNull SlotRange window) {
        final long span = range.end() - range.start();
        if (span == 0) {
            return 0;
        }
        return (window.start() - range.start()) * 100.0 / span;
    }
}
