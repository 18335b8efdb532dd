// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * Fixed delay retry policy for beacon API requests.
 *
 * @param maxAttempts total number of attempts, including the first, at least 1
 * @param delay the pause between two attempts, not negative
 */
public record RetryPolicy(int maxAttempts, @NonNull Duration delay) {
    /** Ten attempts, five seconds apart. */
    public static final RetryPolicy DEFAULT = new RetryPolicy(10, Duration.ofMillis(5000));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts: %d must be at least 1".formatted(maxAttempts));
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay: %s must not be negative".formatted(delay));
        }
    }
}
