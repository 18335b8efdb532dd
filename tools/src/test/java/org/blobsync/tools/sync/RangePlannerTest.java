// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.blobsync.tools.beacon.BeaconApiClient;
import org.blobsync.tools.beacon.RetryPolicy;
import org.blobsync.tools.common.SlotRange;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;
import org.blobsync.tools.utils.TestBeaconNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RangePlanner} and {@link SyncPlan}.
 */
class RangePlannerTest {
    private final TestBeaconNode node = new TestBeaconNode();

    private RangePlanner planner(long activationSlot) {
        return new RangePlanner(
                new BeaconApiClient("http://beacon", node, new RetryPolicy(1, Duration.ZERO), d -> {}),
                activationSlot);
    }

    @Test
    @DisplayName("Start below the activation slot is raised to it")
    void clampsStart() {
        assertEquals(RangePlanner.DENEB_ACTIVATION_SLOT, planner(RangePlanner.DENEB_ACTIVATION_SLOT).clamp(0));
        assertEquals(9_000_000, planner(RangePlanner.DENEB_ACTIVATION_SLOT).clamp(9_000_000));
        assertEquals(100, planner(0).clamp(100));
    }

    @Test
    @DisplayName("Explicit end slot is used without asking the node")
    void explicitEnd() {
        assertEquals(104, planner(0).resolveEnd(OptionalLong.of(104)));
        assertTrue(node.requestedUrls().isEmpty());
    }

    @Test
    @DisplayName("Missing end slot resolves to the head slot")
    void endDefaultsToHead() {
        node.withHead(500);
        final Optional<SyncPlan> plan = planner(0).plan(100, OptionalLong.empty(), 20);
        assertTrue(plan.isPresent());
        assertEquals(new SlotRange(100, 500), plan.get().range());
        assertEquals(List.of("http://beacon/eth/v1/beacon/headers"), node.requestedUrls());
    }

    @Test
    @DisplayName("Head lookup failure stops planning")
    void headNotFound() {
        assertEquals(
                Kind.HEAD_NOT_FOUND,
                assertThrows(SyncException.class, () -> planner(0).plan(100, OptionalLong.empty(), 20))
                        .kind());
    }

    @Test
    @DisplayName("End before the clamped start gives no plan")
    void endBeforeStart() {
        assertTrue(planner(1000).plan(0, OptionalLong.of(999), 20).isEmpty());
        assertTrue(planner(0).plan(10, OptionalLong.of(9), 20).isEmpty());
    }

    @Test
    @DisplayName("Progress is measured from the window start against the whole range")
    void percentComplete() {
        final SyncPlan plan = new SyncPlan(new SlotRange(100, 144), 20);
        final List<SlotRange> windows = plan.windows();
        assertEquals(3, windows.size());
        assertEquals(0.0, plan.percentComplete(windows.get(0)));
        assertEquals(20 * 100.0 / 44, plan.percentComplete(windows.get(1)), 1e-9);
        assertEquals(40 * 100.0 / 44, plan.percentComplete(windows.get(2)), 1e-9);
        assertEquals(0.0, new SyncPlan(new SlotRange(7, 7), 20).percentComplete(new SlotRange(7, 7)));
    }
}
