// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.store;

import static org.blobsync.tools.common.HexBytes.HASH_LENGTH;
import static org.blobsync.tools.common.HexBytes.KZG_COMMITMENT_LENGTH;
import static org.blobsync.tools.common.HexBytes.KZG_PROOF_LENGTH;
import static org.blobsync.tools.common.HexBytes.SIGNATURE_LENGTH;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.beacon.model.BlockHeaderMessage;
import org.blobsync.tools.beacon.model.SignedBlockHeader;
import org.blobsync.tools.common.HexBytes;

/**
 * Binary form of a slot's blob sidecar list, as stored in the key value store.
 * <p>
 * Layout, big endian: sidecar count (int), then for each sidecar: index (long), blob length (int) and blob bytes,
 * commitment (48 bytes), proof (48 bytes), inclusion proof length (int) and that many 32 byte hashes, header slot
 * (long), proposer index (long), parent root, state root and body root (32 bytes each), signature (96 bytes).
 * <p>
 * Encoding parses every hex field to its fixed size, so a malformed field fails the encode rather than being
 * stored.
 */
public final class BlobSidecarCodec {

    private BlobSidecarCodec() {}

    /**
     * Encode a sidecar list.
     *
     * @param sidecars the sidecars
     * @return the encoded bytes
     * @throws IllegalArgumentException if a field is missing, is not a number or is not hex of the right size
     */
    public static byte[] encode(@NonNull List<BlobSidecar> sidecars) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(sidecars.size());
            for (BlobSidecar sidecar : sidecars) {
                writeSidecar(out, sidecar);
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decode a sidecar list written by {@link #encode(List)}. Hex fields come back lower case with {@code 0x}.
     *
     * @param encoded the encoded bytes
     * @return the sidecars
     * @throws IllegalArgumentException if the bytes are truncated or malformed
     */
    public static List<BlobSidecar> decode(@NonNull byte[] encoded) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(encoded))) {
            final int count = in.readInt();
            if (count < 0) {
                throw new IllegalArgumentException("Negative sidecar count " + count);
            }
            final List<BlobSidecar> sidecars = new ArrayList<>(Math.min(count, 16));
            for (int i = 0; i < count; i++) {
                sidecars.add(readSidecar(in));
            }
            if (in.available() > 0) {
                throw new IllegalArgumentException(in.available() + " trailing bytes after sidecar list");
            }
            return sidecars;
        } catch (EOFException e) {
            throw new IllegalArgumentException("Encoded sidecar list is truncated", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeSidecar(DataOutputStream out, BlobSidecar sidecar) throws IOException {
        required(sidecar, "sidecar");
        out.writeLong(parseNumber(sidecar.index(), "index"));
        final byte[] blob = HexBytes.parse(required(sidecar.blob(), "blob"));
        out.writeInt(blob.length);
        out.write(blob);
        out.write(fixed(sidecar.kzgCommitment(), KZG_COMMITMENT_LENGTH, "kzg_commitment"));
        out.write(fixed(sidecar.kzgProof(), KZG_PROOF_LENGTH, "kzg_proof"));
        final List<String> inclusionProof = required(sidecar.kzgCommitmentInclusionProof(), "inclusion proof");
        out.writeInt(inclusionProof.size());
        for (String hash : inclusionProof) {
            out.write(fixed(hash, HASH_LENGTH, "inclusion proof hash"));
        }
        final SignedBlockHeader signedHeader = required(sidecar.signedBlockHeader(), "signed_block_header");
        final BlockHeaderMessage header = required(signedHeader.message(), "header message");
        out.writeLong(parseNumber(header.slot(), "slot"));
        out.writeLong(parseNumber(header.proposerIndex(), "proposer_index"));
        out.write(fixed(header.parentRoot(), HASH_LENGTH, "parent_root"));
        out.write(fixed(header.stateRoot(), HASH_LENGTH, "state_root"));
        out.write(fixed(header.bodyRoot(), HASH_LENGTH, "body_root"));
        out.write(fixed(signedHeader.signature(), SIGNATURE_LENGTH, "signature"));
    }

    private static BlobSidecar readSidecar(DataInputStream in) throws IOException {
        final long index = in.readLong();
        final int blobLength = in.readInt();
        if (blobLength < 0 || blobLength > in.available()) {
            throw new IllegalArgumentException("Invalid blob length " + blobLength);
        }
        final String blob = readHex(in, blobLength);
        final String commitment = readHex(in, KZG_COMMITMENT_LENGTH);
        final String proof = readHex(in, KZG_PROOF_LENGTH);
        final int proofLength = in.readInt();
        if (proofLength < 0 || (long) proofLength * HASH_LENGTH > in.available()) {
            throw new IllegalArgumentException("Invalid inclusion proof length " + proofLength);
        }
        final List<String> inclusionProof = new ArrayList<>(proofLength);
        for (int i = 0; i < proofLength; i++) {
            inclusionProof.add(readHex(in, HASH_LENGTH));
        }
        final BlockHeaderMessage header = new BlockHeaderMessage(
                Long.toUnsignedString(in.readLong()),
                Long.toUnsignedString(in.readLong()),
                readHex(in, HASH_LENGTH),
                readHex(in, HASH_LENGTH),
                readHex(in, HASH_LENGTH));
        final String signature = readHex(in, SIGNATURE_LENGTH);
        return new BlobSidecar(
                Long.toUnsignedString(index),
                blob,
                commitment,
                proof,
                new SignedBlockHeader(header, signature),
                inclusionProof);
    }

    private static String readHex(DataInputStream in, int length) throws IOException {
        final byte[] bytes = new byte[length];
        in.readFully(bytes);
        return HexBytes.toHex(bytes);
    }

    private static byte[] fixed(String hex, int length, String field) {
        try {
            return HexBytes.parseFixed(required(hex, field), length);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + field + ": " + e.getMessage(), e);
        }
    }

    private static long parseNumber(String value, String field) {
        try {
            return Long.parseUnsignedLong(required(value, field));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + field + ": '" + value + "'", e);
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + field);
        }
        return value;
    }
}
