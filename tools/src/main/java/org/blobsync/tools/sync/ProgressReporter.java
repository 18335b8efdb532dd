// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import org.blobsync.tools.common.SlotRange;

/**
 * Receives progress after every committed window.
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * Called once per window, after its records were committed.
     *
     * @param window the committed window
     * @param percentComplete completion of the run, see {@link SyncPlan#percentComplete(SlotRange)}
     */
    void windowCommitted(SlotRange window, double percentComplete);
}
