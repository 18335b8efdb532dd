// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.common.BlockRoot;
import org.blobsync.tools.common.SlotRange;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;

/**
 * Joins the root and sidecar results of a window into write records.
 */
public final class Correlator {

    private Correlator() {}

    /**
     * Build one record per slot of the window, in ascending slot order. Element {@code i} of both lists belongs to
     * slot {@code window.start() + i}.
     *
     * @param window the window the results were fetched for
     * @param roots the root hex strings, empty string where the slot has no header
     * @param sidecars the sidecar lists
     * @return the records, ascending by slot
     * @throws SyncException {@code ROOT_PARSE} if any root is not a 32 byte hex string
     */
    public static List<SlotWriteRecord> correlate(
            @NonNull SlotRange window, @NonNull List<String> roots, @NonNull List<List<BlobSidecar>> sidecars) {
        if (roots.size() != window.size() || sidecars.size() != window.size()) {
            throw new IllegalArgumentException("Window %s has %d slots but got %d roots and %d sidecar lists"
                    .formatted(window, window.size(), roots.size(), sidecars.size()));
        }
        final List<SlotWriteRecord> records = new ArrayList<>(roots.size());
        for (int i = 0; i < roots.size(); i++) {
            final long slot = window.start() + i;
            records.add(new SlotWriteRecord(slot, parseRoot(roots.get(i), slot), sidecars.get(i)));
        }
        return records;
    }

    private static BlockRoot parseRoot(String hex, long slot) {
        try {
            return BlockRoot.parse(hex);
        } catch (IllegalArgumentException e) {
            throw new SyncException(Kind.ROOT_PARSE, slot, "Invalid block root '%s'".formatted(hex), e);
        }
    }
}
