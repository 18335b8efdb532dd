// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SlotRange}.
 */
class SlotRangeTest {

    @Test
    @DisplayName("Rejects negative start and start after end")
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new SlotRange(-1, 5));
        assertThrows(IllegalArgumentException.class, () -> new SlotRange(6, 5));
        assertThrows(IllegalArgumentException.class, () -> new SlotRange(0, Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Size and stream are inclusive of both ends")
    void sizeAndStreamAreInclusive() {
        final SlotRange range = new SlotRange(100, 104);
        assertEquals(5, range.size());
        assertEquals(List.of(100L, 101L, 102L, 103L, 104L), range.stream().boxed().toList());
    }

    @Test
    @DisplayName("Range shorter than a window is a single window")
    void shortRangeIsOneWindow() {
        assertEquals(List.of(new SlotRange(100, 104)), new SlotRange(100, 104).windows(20));
    }

    @Test
    @DisplayName("Last window is cut short at the end of the range")
    void lastWindowIsClamped() {
        assertEquals(
                List.of(new SlotRange(0, 19), new SlotRange(20, 39), new SlotRange(40, 44)),
                new SlotRange(0, 44).windows(20));
    }

    @Test
    @DisplayName("Range that divides evenly has no short window")
    void evenSplit() {
        assertEquals(List.of(new SlotRange(10, 14), new SlotRange(15, 19)), new SlotRange(10, 19).windows(5));
    }

    @Test
    @DisplayName("Window of one slot yields one window per slot")
    void singleSlotWindows() {
        assertEquals(3, new SlotRange(7, 9).windows(1).size());
        assertThrows(IllegalArgumentException.class, () -> new SlotRange(7, 9).windows(0));
    }

    @Test
    @DisplayName("Windows near the top of the slot space do not overflow")
    void windowsNearMaxValue() {
        final long end = Long.MAX_VALUE - 1;
        final List<SlotRange> windows = new SlotRange(end - 2, end).windows(Integer.MAX_VALUE);
        assertEquals(List.of(new SlotRange(end - 2, end)), windows);
    }
}
