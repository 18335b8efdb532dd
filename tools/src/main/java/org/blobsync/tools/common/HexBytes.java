// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.common;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.HexFormat;

/**
 * Conversions between the {@code 0x} prefixed hex strings used by the beacon API and raw bytes.
 */
public final class HexBytes {
    /** Length of roots and hashes. */
    public static final int HASH_LENGTH = 32;
    /** Length of a KZG commitment. */
    public static final int KZG_COMMITMENT_LENGTH = 48;
    /** Length of a KZG proof. */
    public static final int KZG_PROOF_LENGTH = 48;
    /** Length of a BLS signature. */
    public static final int SIGNATURE_LENGTH = 96;

    private static final HexFormat HEX = HexFormat.of();

    private HexBytes() {}

    /**
     * Parse a hex string of any even length, with or without a {@code 0x} prefix.
     *
     * @param hex the hex string
     * @return the decoded bytes
     * @throws IllegalArgumentException if the string is not valid hex
     */
    public static byte[] parse(@NonNull String hex) {
        final String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return HEX.parseHex(digits);
    }

    /**
     * Parse a hex string that must decode to exactly {@code length} bytes.
     *
     * @param hex the hex string
     * @param length the required decoded length
     * @return the decoded bytes
     * @throws IllegalArgumentException if the string is not valid hex or has the wrong length
     */
    public static byte[] parseFixed(@NonNull String hex, int length) {
        final byte[] bytes = parse(hex);
        if (bytes.length != length) {
            throw new IllegalArgumentException(
                    "Expected %d bytes but hex string decodes to %d bytes".formatted(length, bytes.length));
        }
        return bytes;
    }

    /**
     * Format bytes as a lower case {@code 0x} prefixed hex string.
     *
     * @param bytes the bytes
     * @return the hex string
     */
    public static String toHex(@NonNull byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }
}
