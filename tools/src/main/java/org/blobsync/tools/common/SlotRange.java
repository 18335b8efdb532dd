// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.common;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Contiguous range of slots, inclusive of start and end. Start and end must be non-negative with start less than or
 * equal to end.
 */
public record SlotRange(long start, long end) {

    public SlotRange {
        if (start < 0) {
            throw new IllegalArgumentException("SlotRange start: %d must not be negative".formatted(start));
        }
        if (end > Long.MAX_VALUE - 1) {
            throw new IllegalArgumentException(
                    "SlotRange end: %d must not be greater than Long.MAX_VALUE-1".formatted(end));
        }
        if (start > end) {
            throw new IllegalArgumentException(
                    "SlotRange start: %d must not be greater than end: %d".formatted(start, end));
        }
    }

    /**
     * @return the number of slots in the range
     */
    public long size() {
        return end - start + 1;
    }

    /**
     * Split the range into consecutive windows of {@code windowSize} slots. The last window is cut short at
     * {@link #end()}.
     *
     * @param windowSize the number of slots per window, at least 1
     * @return the windows in ascending order
     */
    @NonNull
    public List<SlotRange> windows(final int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize: %d must be at least 1".formatted(windowSize));
        }
        final List<SlotRange> windows = new ArrayList<>();
        long windowStart = start;
        while (windowStart <= end) {
            final long windowEnd = end - windowStart < windowSize ? end : windowStart + windowSize - 1;
            windows.add(new SlotRange(windowStart, windowEnd));
            if (windowEnd == end) {
                break;
            }
            windowStart = windowEnd + 1;
        }
        return windows;
    }

    public LongStream stream() {
        return LongStream.rangeClosed(start, end);
    }

    @NonNull
    @Override
    public String toString() {
        return start + "->" + end;
    }
}
