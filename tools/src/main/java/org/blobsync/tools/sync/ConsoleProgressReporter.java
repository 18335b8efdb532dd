// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.PrintWriter;
import java.util.Locale;
import org.blobsync.tools.common.SlotRange;
import picocli.CommandLine.Help.Ansi;

/**
 * Prints one line per committed window.
 */
public final class ConsoleProgressReporter implements ProgressReporter {
    private final PrintWriter out;

    public ConsoleProgressReporter(@NonNull PrintWriter out) {
        this.out = out;
    }

    @Override
    public void windowCommitted(SlotRange window, double percentComplete) {
        out.println(Ansi.AUTO.string("@|cyan blobs downloaded for|@ " + window.start() + ".." + window.end()
                + " @|yellow [" + String.format(Locale.ROOT, "%.2f", percentComplete) + "%]|@"));
        out.flush();
    }
}
