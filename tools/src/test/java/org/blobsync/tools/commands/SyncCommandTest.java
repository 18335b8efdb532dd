// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.blobsync.tools.store.JsonLinesSink;
import org.blobsync.tools.store.SqliteKeyValueStore;
import org.blobsync.tools.sync.RangePlanner;
import org.blobsync.tools.utils.TestBeaconNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/**
 * Command line tests for {@link SyncCommand} and {@link HeadCommand}.
 */
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class SyncCommandTest {
    private static final long DENEB = RangePlanner.DENEB_ACTIVATION_SLOT;

    @TempDir
    Path tempDir;

    private final TestBeaconNode node = new TestBeaconNode();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(Object command, String... args) {
        final CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    @DisplayName("Sync of a range prints progress and a summary")
    void syncRange() {
        node.withBlocks(DENEB, DENEB + 4, 1);

        final int exitCode = execute(
                new SyncCommand(node),
                "--api-url", "http://beacon:5052",
                "-f", Long.toString(DENEB),
                "-t", Long.toString(DENEB + 4),
                "-c", "3",
                "-d", tempDir.toString(),
                "--sink", "JSONL",
                "--retry-delay-ms", "0");

        assertEquals(0, exitCode, err.toString());
        final String output = out.toString();
        assertTrue(output.contains("blobs downloaded for " + DENEB + ".." + (DENEB + 2) + " [0.00%]"), output);
        assertTrue(output.contains("blobs downloaded for " + (DENEB + 3) + ".." + (DENEB + 4) + " [75.00%]"), output);
        assertTrue(output.contains("Sync complete"), output);
        assertTrue(Files.exists(tempDir.resolve(JsonLinesSink.DEFAULT_FILE_NAME)));
    }

    @Test
    @DisplayName("Start before the fork is raised to the fork slot and the store sink is the default")
    void defaultsToStoreAndClampsStart() {
        node.withBlock(DENEB, 1).withHead(DENEB);

        final int exitCode =
                execute(new SyncCommand(node), "--api-url", "http://beacon", "-f", "0", "-d", tempDir.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.exists(tempDir.resolve(SqliteKeyValueStore.DEFAULT_FILE_NAME)));
        assertTrue(node.requestedSlots().contains(DENEB));
        assertEquals(1, node.requestedSlots().size());
    }

    @Test
    @DisplayName("Failed run exits with 1 and names the failure")
    void failedRun() {
        node.withBlocks(DENEB, DENEB + 1, 1).withUnreachableSlot(DENEB + 1);

        final int exitCode = execute(
                new SyncCommand(node),
                "--api-url", "http://beacon",
                "-f", Long.toString(DENEB),
                "-t", Long.toString(DENEB + 1),
                "-d", tempDir.toString(),
                "--retries", "2",
                "--retry-delay-ms", "0");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("RETRY_EXHAUSTED"), err.toString());
    }

    @Test
    @DisplayName("Invalid option values are usage errors")
    void invalidOptions() {
        assertEquals(
                CommandLine.ExitCode.USAGE,
                execute(new SyncCommand(node), "--api-url", "http://beacon", "-f", "1", "-c", "0", "-d", "x"));
        assertEquals(CommandLine.ExitCode.USAGE, execute(new SyncCommand(node), "-f", "1", "-d", "x"));
        assertEquals(
                CommandLine.ExitCode.USAGE,
                execute(new SyncCommand(node), "--api-url", "http://beacon", "-f", "1", "-c", "2000000000", "-d", "x"));
        assertTrue(err.toString().contains("must be between 1 and 1024"), err.toString());
        assertTrue(node.requestedUrls().isEmpty());
    }

    @Test
    @DisplayName("Head command prints the head slot")
    void headCommand() {
        node.withHead(DENEB + 10);
        assertEquals(0, execute(new HeadCommand(node), "--api-url", "http://beacon"));
        assertTrue(out.toString().contains("Head slot: " + (DENEB + 10)), out.toString());
    }

    @Test
    @DisplayName("Head command fails when the node has no head")
    void headCommandWithoutHead() {
        assertEquals(1, execute(new HeadCommand(node), "--api-url", "http://beacon"));
        assertTrue(err.toString().contains("HEAD_NOT_FOUND"), err.toString());
    }
}
