// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {
    /** Sleeps on the calling thread. */
    Sleeper THREAD_SLEEP = delay -> TimeUnit.MILLISECONDS.sleep(delay.toMillis());

    /**
     * Block the calling thread for {@code delay}.
     *
     * @param delay how long to wait
     * @throws InterruptedException if interrupted while waiting
     */
    void sleep(Duration delay) throws InterruptedException;
}
