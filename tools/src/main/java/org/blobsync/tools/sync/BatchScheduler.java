// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.blobsync.tools.beacon.BeaconApiClient;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.common.SlotRange;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.store.PersistenceSink;

/**
 * Drives a sync run one window at a time.
 * <p>
 * For each window every slot gets a sidecar fetch and a root fetch, all started at once on a pool of
 * {@code 2 * windowSize} threads. The window waits for every fetch to finish. If any of them failed the run stops
 * with that failure and nothing of the window is committed; otherwise the results are correlated, committed to the
 * sink and reported. A window only starts after the previous one was committed, so the sink never sees two writers.
 */
public final class BatchScheduler implements AutoCloseable {
    private static final System.Logger LOGGER = System.getLogger(BatchScheduler.class.getName());

    private final BeaconApiClient client;
    private final PersistenceSink sink;
    private final ProgressReporter progress;
    private final ExecutorService fetchExecutor;

    /**
     * @param client the beacon API client used for every fetch
     * @param sink where committed windows go, owned by the caller
     * @param progress notified after each commit
     * @param windowSize slots per window, sizes the fetch pool
     */
    public BatchScheduler(
            @NonNull BeaconApiClient client,
            @NonNull PersistenceSink sink,
            @NonNull ProgressReporter progress,
            int windowSize) {
        if (windowSize < 1 || windowSize > SyncConfiguration.MAX_CONCURRENCY) {
            throw new IllegalArgumentException("windowSize: %d must be between 1 and %d"
                    .formatted(windowSize, SyncConfiguration.MAX_CONCURRENCY));
        }
        this.client = client;
        this.sink = sink;
        this.progress = progress;
        final AtomicInteger threadCount = new AtomicInteger();
        this.fetchExecutor = Executors.newFixedThreadPool(2 * windowSize, r -> {
            Thread t = new Thread(r, "blob-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sync every window of the plan, in order.
     *
     * @param plan the resolved plan
     * @return what was committed
     * @throws SyncException on the first failure, windows committed before it stay committed
     */
    public SyncSummary run(@NonNull SyncPlan plan) {
        LOGGER.log(INFO, "Syncing slots {0} in windows of {1}", plan.range(), plan.windowSize());
        SyncSummary summary = SyncSummary.EMPTY;
        for (SlotRange window : plan.windows()) {
            final List<SlotWriteRecord> records = fetchWindow(window);
            LOGGER.log(DEBUG, "Committing {0} records for window {1}", records.size(), window);
            sink.commit(records);
            summary = summary.plus(records);
            progress.windowCommitted(window, plan.percentComplete(window));
        }
        LOGGER.log(INFO, "Sync of {0} complete: {1}", plan.range(), summary);
        return summary;
    }

    /**
     * Fetch roots and sidecars for every slot of a window concurrently and correlate them.
     *
     * @param window the window
     * @return the records of the window, ascending by slot
     */
    List<SlotWriteRecord> fetchWindow(@NonNull SlotRange window) {
        final List<CompletableFuture<List<BlobSidecar>>> sidecarFutures = new ArrayList<>();
        final List<CompletableFuture<String>> rootFutures = new ArrayList<>();
        window.stream().forEach(slot -> {
            sidecarFutures.add(CompletableFuture.supplyAsync(() -> client.fetchBlobSidecars(slot), fetchExecutor));
            rootFutures.add(CompletableFuture.supplyAsync(() -> client.fetchBlockRoot(slot), fetchExecutor));
        });

        final List<CompletableFuture<?>> all = new ArrayList<>(sidecarFutures);
        all.addAll(rootFutures);
        try {
            // allOf only completes once every task is done, failed or not
            CompletableFuture.allOf(all.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        final List<List<BlobSidecar>> sidecars =
                sidecarFutures.stream().map(CompletableFuture::join).toList();
        final List<String> roots = rootFutures.stream().map(CompletableFuture::join).toList();
        return Correlator.correlate(window, roots, sidecars);
    }

    private static RuntimeException unwrap(CompletionException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.log(DEBUG, "Fetch threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
