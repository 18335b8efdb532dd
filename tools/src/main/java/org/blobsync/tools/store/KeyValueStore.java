// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Key value store with atomic multi key writes.
 */
public interface KeyValueStore extends Closeable {

    /**
     * Apply all operations as one unit. After a failure, or a crash in the middle, none of them is visible.
     *
     * @param operations the operations, applied in order
     * @throws IOException if the batch could not be applied
     */
    void doAtomically(@NonNull List<KeyValueOp> operations) throws IOException;

    /**
     * Read a value.
     *
     * @param column the column
     * @param key the key
     * @return the value, empty if the key is not present
     * @throws IOException if the store could not be read
     */
    Optional<byte[]> get(@NonNull String column, @NonNull byte[] key) throws IOException;
}
