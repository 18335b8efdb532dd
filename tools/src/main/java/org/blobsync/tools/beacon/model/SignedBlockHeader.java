// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

/**
 * A beacon block header with the proposer's signature.
 *
 * @param message the header
 * @param signature the BLS signature, hex
 */
public record SignedBlockHeader(BlockHeaderMessage message, String signature) {}
