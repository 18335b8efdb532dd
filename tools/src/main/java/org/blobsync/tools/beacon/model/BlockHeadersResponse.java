// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

import java.util.List;

/** Body of {@code /eth/v1/beacon/headers}. The first entry is the head. */
public record BlockHeadersResponse(boolean executionOptimistic, boolean finalized, List<BlockHeaderData> data) {}
