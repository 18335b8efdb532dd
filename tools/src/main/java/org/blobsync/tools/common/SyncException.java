// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.common;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.OptionalLong;

/**
 * Fatal failure of a sync run. Every failure that escapes a component is one of these; the run stops at the first
 * one and the window in flight is not committed.
 */
public class SyncException extends RuntimeException {

    /** The kinds of failure that stop a sync run. */
    public enum Kind {
        /** A 200 response body could not be decoded, or the server answered with an unexpected status. */
        DECODE,
        /** Every attempt of a fetch failed at the transport level. */
        RETRY_EXHAUSTED,
        /** The head headers query returned no header. */
        HEAD_NOT_FOUND,
        /** A block root returned by the header endpoint is not a 32 byte hex string. */
        ROOT_PARSE,
        /** The persistence sink failed to commit a window. */
        SINK_COMMIT,
        /** The run was interrupted while waiting. */
        INTERRUPTED
    }

    private final Kind kind;
    private final long slot;

    /**
     * Create an exception that is not tied to a slot.
     *
     * @param kind the kind of failure
     * @param message the detail message
     * @param cause the cause, may be null
     */
    public SyncException(@NonNull Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    /**
     * Create an exception for a failure while working on one slot.
     *
     * @param kind the kind of failure
     * @param slot the slot being worked on, or -1 when there is none
     * @param message the detail message
     * @param cause the cause, may be null
     */
    public SyncException(@NonNull Kind kind, long slot, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.slot = slot;
    }

    /**
     * Create an exception for a failure while working on one slot.
     *
     * @param kind the kind of failure
     * @param slot the slot being worked on
     * @param message the detail message
     */
    public SyncException(@NonNull Kind kind, long slot, String message) {
        this(kind, slot, message, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the slot the failure belongs to, empty if it is not tied to a slot
     */
    public OptionalLong slot() {
        return slot < 0 ? OptionalLong.empty() : OptionalLong.of(slot);
    }

    @Override
    public String toString() {
        return slot < 0
                ? "%s: %s".formatted(kind, getMessage())
                : "%s at slot %d: %s".formatted(kind, slot, getMessage());
    }
}
