// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.commands;

import java.util.concurrent.Callable;
import org.blobsync.tools.beacon.BeaconApiClient;
import org.blobsync.tools.beacon.BeaconApiTransport;
import org.blobsync.tools.beacon.HttpClientTransport;
import org.blobsync.tools.beacon.RetryPolicy;
import org.blobsync.tools.common.SyncException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Print the current head slot of a beacon node.
 */
@Command(name = "head", description = "Print the head slot of a beacon node", mixinStandardHelpOptions = true)
public class HeadCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(
            names = {"--api-url"},
            required = true,
            description = "Base URL of the beacon node API, e.g. http://localhost:5052")
    private String apiUrl;

    private final BeaconApiTransport transport;

    public HeadCommand() {
        this(new HttpClientTransport());
    }

    public HeadCommand(BeaconApiTransport transport) {
        this.transport = transport;
    }

    @Override
    public Integer call() {
        try {
            final long head = new BeaconApiClient(apiUrl, transport, RetryPolicy.DEFAULT).fetchHeadSlot();
            spec.commandLine().getOut().println(Ansi.AUTO.string("@|yellow Head slot:|@ " + head));
            return 0;
        } catch (SyncException e) {
            spec.commandLine().getErr().println(Ansi.AUTO.string("@|bold,red Head lookup failed|@ " + e));
            return 1;
        }
    }
}
