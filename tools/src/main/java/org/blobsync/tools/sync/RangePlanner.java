// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.sync;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Optional;
import java.util.OptionalLong;
import org.blobsync.tools.beacon.BeaconApiClient;
import org.blobsync.tools.common.SlotRange;

/**
 * Works out which slots a run covers.
 */
public final class RangePlanner {
    private static final System.Logger LOGGER = System.getLogger(RangePlanner.class.getName());

    /** First mainnet slot of the Deneb fork, blobs did not exist before it. */
    public static final long DENEB_ACTIVATION_SLOT = 8_626_176L;

    private final BeaconApiClient client;
    private final long activationSlot;

    public RangePlanner(@NonNull BeaconApiClient client) {
        this(client, DENEB_ACTIVATION_SLOT);
    }

    /**
     * @param client used to look up the head slot when no end slot is given
     * @param activationSlot the first slot that can have blobs
     */
    public RangePlanner(@NonNull BeaconApiClient client, long activationSlot) {
        this.client = client;
        this.activationSlot = activationSlot;
    }

    /**
     * Raise a start slot to the activation slot if it is below it.
     *
     * @param start the requested start slot
     * @return the effective start slot
     */
    public long clamp(long start) {
        if (start < activationSlot) {
            LOGGER.log(
                    WARNING,
                    "Using {0,number,#} instead of {1,number,#} since blobs did not exist before that slot",
                    activationSlot,
                    start);
            return activationSlot;
        }
        return start;
    }

    /**
     * Return the requested end slot, or the current head slot if none was requested.
     *
     * @param end the requested end slot
     * @return the effective end slot
     * @throws org.blobsync.tools.common.SyncException {@code HEAD_NOT_FOUND} if the head cannot be found
     */
    public long resolveEnd(@NonNull OptionalLong end) {
        if (end.isPresent()) {
            return end.getAsLong();
        }
        final long head = client.fetchHeadSlot();
        LOGGER.log(INFO, "Head slot: {0,number,#}", head);
        return head;
    }

    /**
     * Resolve the full plan of a run.
     *
     * @param start the requested start slot
     * @param end the requested end slot, empty to sync up to the head
     * @param windowSize the number of slots per window
     * @return the plan, empty if the effective end is before the effective start
     */
    public Optional<SyncPlan> plan(long start, @NonNull OptionalLong end, int windowSize) {
        final long from = clamp(start);
        final long to = resolveEnd(end);
        if (to < from) {
            LOGGER.log(WARNING, "Nothing to sync, end slot {0,number,#} is before start slot {1,number,#}", to, from);
            return Optional.empty();
        }
        return Optional.of(new SyncPlan(new SlotRange(from, to), windowSize));
    }
}
