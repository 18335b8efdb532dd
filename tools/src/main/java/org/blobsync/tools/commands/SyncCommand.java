// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.commands;

import static java.lang.System.Logger.Level.ERROR;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import org.blobsync.tools.beacon.BeaconApiTransport;
import org.blobsync.tools.beacon.HttpClientTransport;
import org.blobsync.tools.beacon.RetryPolicy;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.store.SinkType;
import org.blobsync.tools.sync.BlobSyncRunner;
import org.blobsync.tools.sync.ConsoleProgressReporter;
import org.blobsync.tools.sync.SyncConfiguration;
import org.blobsync.tools.sync.SyncSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Sync blob sidecars and block roots for a slot range into the data directory.
 */
@Command(
        name = "sync",
        description = "Download blob sidecars for a slot range and store them in the data directory",
        mixinStandardHelpOptions = true)
public class SyncCommand implements Callable<Integer> {
    private static final System.Logger LOGGER = System.getLogger(SyncCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Option(
            names = {"--api-url"},
            required = true,
            description = "Base URL of the beacon node API, e.g. http://localhost:5052")
    private String apiUrl;

    @Option(
            names = {"-f", "--from-slot"},
            required = true,
            description = "First slot to sync, raised to the Deneb fork slot if lower")
    private long fromSlot;

    @Option(
            names = {"-t", "--to-slot"},
            description = "Last slot to sync (inclusive), defaults to the current head slot")
    private Long toSlot;

    @Option(
            names = {"-c", "--concurrency"},
            defaultValue = "20",
            description = "Number of slots fetched concurrently per window (default: ${DEFAULT-VALUE})")
    private int concurrency;

    @Option(
            names = {"-d", "--data-dir"},
            required = true,
            description = "Directory the sink writes into")
    private Path dataDir;

    @Option(
            names = {"--sink"},
            defaultValue = "STORE",
            description = "Where to write: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private SinkType sink;

    @Option(
            names = {"--retries"},
            defaultValue = "10",
            description = "Attempts per request when the node cannot be reached (default: ${DEFAULT-VALUE})")
    private int retries;

    @Option(
            names = {"--retry-delay-ms"},
            defaultValue = "5000",
            description = "Delay between attempts in milliseconds (default: ${DEFAULT-VALUE})")
    private long retryDelayMs;

    private final BeaconApiTransport transport;

    public SyncCommand() {
        this(new HttpClientTransport());
    }

    /**
     * @param transport the transport used for every request
     */
    public SyncCommand(BeaconApiTransport transport) {
        this.transport = transport;
    }

    @Override
    public Integer call() {
        final SyncConfiguration config = configuration();
        try {
            final SyncSummary summary = new BlobSyncRunner(transport)
                    .run(config, new ConsoleProgressReporter(spec.commandLine().getOut()));
            spec.commandLine()
                    .getOut()
                    .println(Ansi.AUTO.string("@|bold,green Sync complete:|@ " + summary.slots() + " slots in "
                            + summary.windows() + " windows, " + summary.sidecars() + " sidecars from "
                            + summary.slotsWithBlobs() + " slots with blobs"));
            return 0;
        } catch (SyncException e) {
            LOGGER.log(ERROR, "Sync failed", e);
            spec.commandLine().getErr().println(Ansi.AUTO.string("@|bold,red Sync failed|@ " + e));
            return 1;
        } catch (IOException e) {
            LOGGER.log(ERROR, "Sync failed", e);
            spec.commandLine().getErr().println(Ansi.AUTO.string("@|bold,red Storage error|@ " + e.getMessage()));
            return 1;
        }
    }

    /** Validate the options and collect them into the run settings. */
    SyncConfiguration configuration() {
        try {
            return new SyncConfiguration(
                    apiUrl,
                    fromSlot,
                    toSlot == null ? OptionalLong.empty() : OptionalLong.of(toSlot),
                    concurrency,
                    dataDir,
                    sink,
                    new RetryPolicy(retries, Duration.ofMillis(retryDelayMs)));
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
