// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;
import java.util.OptionalLong;
import org.blobsync.tools.beacon.RetryPolicy;
import org.blobsync.tools.store.SinkType;

/**
 * Settings of one sync run.
 *
 * @param apiUrl the beacon API base URL
 * @param fromSlot the requested first slot, raised to the activation slot if lower
 * @param toSlot the requested last slot, empty to sync up to the current head
 * @param concurrency slots per window, at most {@link #MAX_CONCURRENCY}
 * @param dataDir directory the sink writes into
 * @param sink which sink to write with
 * @param retryPolicy retry policy of every beacon API request
 */
public record SyncConfiguration(
        @NonNull String apiUrl,
        long fromSlot,
        @NonNull OptionalLong toSlot,
        int concurrency,
        @NonNull Path dataDir,
        @NonNull SinkType sink,
        @NonNull RetryPolicy retryPolicy) {

    /** Upper bound of slots per window, each slot takes two fetch threads. */
    public static final int MAX_CONCURRENCY = 1024;

    public SyncConfiguration {
        if (apiUrl.isBlank()) {
            throw new IllegalArgumentException("apiUrl must not be blank");
        }
        if (fromSlot < 0) {
            throw new IllegalArgumentException("fromSlot: %d must not be negative".formatted(fromSlot));
        }
        if (toSlot.isPresent() && toSlot.getAsLong() < 0) {
            throw new IllegalArgumentException("toSlot: %d must not be negative".formatted(toSlot.getAsLong()));
        }
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException("concurrency: %d must be between 1 and %d"
                    .formatted(concurrency, MAX_CONCURRENCY));
        }
    }
}
