// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import org.blobsync.tools.commands.HeadCommand;
import org.blobsync.tools.commands.SyncCommand;
import org.blobsync.tools.logging.CleanColorfulFormatter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.PropertiesDefaultProvider;
import picocli.CommandLine.Spec;

/**
 * Command line tool for backfilling beacon chain blob sidecars.
 */
@Command(
        name = "blob-sync",
        mixinStandardHelpOptions = true,
        version = "BlobSync 0.1",
        description = "Backfills blob sidecars and block roots from a beacon node API into local storage",
        subcommands = {SyncCommand.class, HeadCommand.class})
public final class BlobSyncTool implements Runnable {
    private static final System.Logger LOGGER = System.getLogger(BlobSyncTool.class.getName());

    @Spec
    CommandSpec spec;

    /**
     * Empty Default constructor to remove Javadoc warning
     */
    public BlobSyncTool() {}

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Build the command line with all subcommands and settings applied.
     *
     * @return the command line
     */
    public static CommandLine commandLine() {
        return new CommandLine(new BlobSyncTool())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setDefaultValueProvider(new PropertiesDefaultProvider());
    }

    /**
     * Main entry point for the app
     * @param args command line arguments
     */
    public static void main(String... args) {
        configureLogging();
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Load {@code logging.properties} from the classpath unless a logging config file was given with
     * {@code java.util.logging.config.file}.
     */
    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            LOGGER.log(DEBUG, "External logging configuration found");
            return;
        }
        try (InputStream loggingConfigIn =
                BlobSyncTool.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (loggingConfigIn != null) {
                LogManager.getLogManager().readConfiguration(loggingConfigIn);
            } else {
                LOGGER.log(INFO, "No logging configuration found");
            }
        } catch (IOException e) {
            LOGGER.log(INFO, "Failed to load logging configuration", e);
        }
        CleanColorfulFormatter.makeLoggingColorful();
    }
}
