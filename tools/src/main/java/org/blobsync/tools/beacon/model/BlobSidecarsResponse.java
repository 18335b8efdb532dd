// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon.model;

import java.util.List;

/** Body of a blob sidecars response. */
public record BlobSidecarsResponse(List<BlobSidecar> data) {}
