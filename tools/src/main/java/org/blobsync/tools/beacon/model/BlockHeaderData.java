// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

/**
 * A header entry of the headers endpoints.
 *
 * @param root the block root, hex
 * @param canonical whether the block is on the canonical chain
 * @param header the signed header
 */
public record BlockHeaderData(String root, boolean canonical, SignedBlockHeader header) {}
