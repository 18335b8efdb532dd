// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

/** Body of {@code /eth/v1/beacon/headers/{slot}}. */
public record SingleBlockHeaderResponse(boolean executionOptimistic, boolean finalized, BlockHeaderData data) {}
