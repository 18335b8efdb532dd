// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.common.BlockRoot;

/**
 * Everything fetched for one slot, ready to be committed.
 *
 * @param slot the slot
 * @param root the canonical block root, {@link BlockRoot#EMPTY} if the slot has no header
 * @param sidecars the blob sidecars in index order, empty if the slot has no block or no blobs
 */
public record SlotWriteRecord(long slot, @NonNull BlockRoot root, @NonNull List<BlobSidecar> sidecars) {

    public SlotWriteRecord {
        if (slot < 0) {
            throw new IllegalArgumentException("slot: %d must not be negative".formatted(slot));
        }
        sidecars = Collections.unmodifiableList(new ArrayList<>(sidecars));
    }
}
