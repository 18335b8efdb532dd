// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

import java.util.List;

/**
 * One blob sidecar as returned by {@code /eth/v1/beacon/blob_sidecars/{slot}}.
 *
 * @param index the index of the blob within the block, decimal
 * @param blob the blob payload, hex
 * @param kzgCommitment the KZG commitment to the blob, hex
 * @param kzgProof the KZG proof, hex
 * @param signedBlockHeader the header of the block the blob belongs to
 * @param kzgCommitmentInclusionProof merkle branch proving the commitment is in the block body, hex hashes
 */
public record BlobSidecar(
        String index,
        String blob,
        String kzgCommitment,
        String kzgProof,
        SignedBlockHeader signedBlockHeader,
        List<String> kzgCommitmentInclusionProof) {}
