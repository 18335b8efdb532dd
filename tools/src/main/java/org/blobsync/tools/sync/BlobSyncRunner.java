// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.Optional;
import org.blobsync.tools.beacon.BeaconApiClient;
import org.blobsync.tools.beacon.BeaconApiTransport;
import org.blobsync.tools.beacon.Sleeper;
import org.blobsync.tools.store.PersistenceSink;

/**
 * Wires the pipeline for one run: plan the range, open the sink, then let the {@link BatchScheduler} work through
 * the windows.
 */
public final class BlobSyncRunner {
    private static final System.Logger LOGGER = System.getLogger(BlobSyncRunner.class.getName());

    private final BeaconApiTransport transport;
    private final long activationSlot;
    private final Sleeper sleeper;

    public BlobSyncRunner(@NonNull BeaconApiTransport transport) {
        this(transport, RangePlanner.DENEB_ACTIVATION_SLOT, Sleeper.THREAD_SLEEP);
    }

    /**
     * @param transport the HTTP transport for all requests
     * @param activationSlot the first slot that can have blobs
     * @param sleeper waits between retry attempts
     */
    public BlobSyncRunner(@NonNull BeaconApiTransport transport, long activationSlot, @NonNull Sleeper sleeper) {
        this.transport = transport;
        this.activationSlot = activationSlot;
        this.sleeper = sleeper;
    }

    /**
     * Run a sync.
     *
     * @param config the run settings
     * @param progress receives progress after every window
     * @return what was committed
     * @throws IOException if the sink cannot be opened or closed
     * @throws org.blobsync.tools.common.SyncException on the first failure of the pipeline
     */
    public SyncSummary run(@NonNull SyncConfiguration config, @NonNull ProgressReporter progress)
            throws IOException {
        final BeaconApiClient client =
                new BeaconApiClient(config.apiUrl(), transport, config.retryPolicy(), sleeper);
        final Optional<SyncPlan> plan =
                new RangePlanner(client, activationSlot).plan(config.fromSlot(), config.toSlot(), config.concurrency());
        if (plan.isEmpty()) {
            return SyncSummary.EMPTY;
        }
        LOGGER.log(INFO, "Writing to {0} sink in {1}", config.sink(), config.dataDir());
        try (PersistenceSink sink = config.sink().open(config.dataDir());
                BatchScheduler scheduler = new BatchScheduler(client, sink, progress, plan.get().windowSize())) {
            return scheduler.run(plan.get());
        }
    }
}
