// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.blobsync.tools.common.HexBytes;

/**
 * One write of an atomic batch: store {@code value} under {@code key} in {@code column}, replacing any previous
 * value.
 *
 * @param column the column (table namespace) of the key
 * @param key the 32 byte key
 * @param value the value bytes
 */
public record KeyValueOp(@NonNull String column, @NonNull byte[] key, @NonNull byte[] value) {

    public KeyValueOp {
        if (key.length != HexBytes.HASH_LENGTH) {
            throw new IllegalArgumentException(
                    "key must be %d bytes but was %d".formatted(HexBytes.HASH_LENGTH, key.length));
        }
    }

    public static KeyValueOp put(@NonNull String column, @NonNull byte[] key, @NonNull byte[] value) {
        return new KeyValueOp(column, key, value);
    }
}
