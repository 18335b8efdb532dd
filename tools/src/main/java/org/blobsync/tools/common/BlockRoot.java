// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.common;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;

/**
 * The 32 byte root of the canonical block header at a slot. {@link #EMPTY} stands for a slot that has no header.
 */
public final class BlockRoot {
    /** Sentinel for a slot whose header lookup returned not found. */
    public static final BlockRoot EMPTY = new BlockRoot(new byte[0]);

    private final byte[] bytes;

    private BlockRoot(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Parse a root as returned by the header endpoint. The empty string maps to {@link #EMPTY}.
     *
     * @param hex a {@code 0x} prefixed 64 digit hex string, or the empty string
     * @return the block root
     * @throws IllegalArgumentException if the string is neither empty nor a 32 byte hex value
     */
    public static BlockRoot parse(@NonNull String hex) {
        if (hex.isEmpty()) {
            return EMPTY;
        }
        return new BlockRoot(HexBytes.parseFixed(hex, HexBytes.HASH_LENGTH));
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * @return a copy of the root bytes, empty for {@link #EMPTY}
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * @return the {@code 0x} prefixed hex form, or the empty string for {@link #EMPTY}
     */
    public String toHex() {
        return isEmpty() ? "" : HexBytes.toHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlockRoot other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isEmpty() ? "<empty>" : toHex();
    }
}
