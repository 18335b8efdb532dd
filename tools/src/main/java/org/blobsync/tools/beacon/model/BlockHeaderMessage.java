// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

/**
 * The unsigned part of a beacon block header. Numbers and roots are kept as the strings the API returns.
 *
 * @param slot the slot, decimal
 * @param proposerIndex the validator index of the proposer, decimal
 * @param parentRoot the parent block root, hex
 * @param stateRoot the state root, hex
 * @param bodyRoot the block body root, hex
 */
public record BlockHeaderMessage(
        String slot, String proposerIndex, String parentRoot, String stateRoot, String bodyRoot) {}
