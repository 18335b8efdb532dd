// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.google.gson.JsonParseException;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.List;
import org.blobsync.tools.beacon.model.BlobSidecar;
import org.blobsync.tools.beacon.model.BlobSidecarsResponse;
import org.blobsync.tools.beacon.model.BlockHeaderData;
import org.blobsync.tools.beacon.model.BlockHeadersResponse;
import org.blobsync.tools.beacon.model.SingleBlockHeaderResponse;
import org.blobsync.tools.common.SyncException;
import org.blobsync.tools.common.SyncException.Kind;

/**
 * Client for the beacon node endpoints needed to backfill blob sidecars.
 * <p>
 * Every request goes through the same retry loop: a request that gets no response at all (connection refused,
 * timeout, reset) uses up one attempt and is retried after the policy's delay. Once a response arrives it is final:
 * a 404 becomes an empty result for the per-slot endpoints, a 200 is decoded, and anything else fails the run. A
 * body that cannot be decoded is never retried.
 * <p>
 * Instances are thread safe as long as the transport is; the batch scheduler calls them from many threads at once.
 */
public class BeaconApiClient {
    private static final System.Logger LOGGER = System.getLogger(BeaconApiClient.class.getName());

    private final String baseUrl;
    private final BeaconApiTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    /**
     * Create a client that sleeps on the calling thread between attempts.
     *
     * @param baseUrl the beacon API base URL, for example {@code http://localhost:5052}
     * @param transport the HTTP transport
     * @param retryPolicy attempts and delay for requests that get no response
     */
    public BeaconApiClient(
            @NonNull String baseUrl, @NonNull BeaconApiTransport transport, @NonNull RetryPolicy retryPolicy) {
        this(baseUrl, transport, retryPolicy, Sleeper.THREAD_SLEEP);
    }

    public BeaconApiClient(
            @NonNull String baseUrl,
            @NonNull BeaconApiTransport transport,
            @NonNull RetryPolicy retryPolicy,
            @NonNull Sleeper sleeper) {
        this.baseUrl = baseUrl;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Fetch the blob sidecars of a slot.
     *
     * @param slot the slot
     * @return the sidecars in index order, empty if the slot has no block
     * @throws SyncException {@code RETRY_EXHAUSTED} if no attempt got a response, {@code DECODE} if the response
     *     could not be used
     */
    public List<BlobSidecar> fetchBlobSidecars(long slot) {
        final HttpResult result = getWithRetry(BeaconApiUrls.blobSidecars(baseUrl, slot), slot);
        // the proposer missed the slot, there is no block and so no blobs
        if (result.statusCode() == HttpResult.NOT_FOUND) {
            return List.of();
        }
        final BlobSidecarsResponse response = decode(result, BlobSidecarsResponse.class, slot);
        if (response.data() == null) {
            throw new SyncException(Kind.DECODE, slot, "Blob sidecars response has no data field");
        }
        if (response.data().contains(null)) {
            throw new SyncException(Kind.DECODE, slot, "Blob sidecars response has a null entry");
        }
        return response.data();
    }

    /**
     * Fetch the root of the canonical block header at a slot.
     *
     * @param slot the slot
     * @return the root as the API returns it (hex), or the empty string if the slot has no header
     * @throws SyncException {@code RETRY_EXHAUSTED} if no attempt got a response, {@code DECODE} if the response
     *     could not be used
     */
    public String fetchBlockRoot(long slot) {
        final HttpResult result = getWithRetry(BeaconApiUrls.header(baseUrl, slot), slot);
        if (result.statusCode() == HttpResult.NOT_FOUND) {
            return "";
        }
        final SingleBlockHeaderResponse response = decode(result, SingleBlockHeaderResponse.class, slot);
        if (response.data() == null || response.data().root() == null) {
            throw new SyncException(Kind.DECODE, slot, "Block header response has no root");
        }
        return response.data().root();
    }

    /**
     * Fetch the slot of the current chain head.
     *
     * @return the head slot
     * @throws SyncException {@code HEAD_NOT_FOUND} if the node returned no header, {@code RETRY_EXHAUSTED} or
     *     {@code DECODE} as for the other requests
     */
    public long fetchHeadSlot() {
        final HttpResult result = getWithRetry(BeaconApiUrls.headers(baseUrl), -1);
        if (result.statusCode() == HttpResult.NOT_FOUND) {
            throw new SyncException(Kind.HEAD_NOT_FOUND, "Head headers endpoint returned 404", null);
        }
        final BlockHeadersResponse response = decode(result, BlockHeadersResponse.class, -1);
        if (response.data() == null || response.data().isEmpty()) {
            throw new SyncException(Kind.HEAD_NOT_FOUND, "No headers found", null);
        }
        final BlockHeaderData head = response.data().get(0);
        if (head == null
                || head.header() == null
                || head.header().message() == null
                || head.header().message().slot() == null) {
            throw new SyncException(Kind.DECODE, "Head header has no slot", null);
        }
        try {
            return Long.parseLong(head.header().message().slot());
        } catch (NumberFormatException e) {
            throw new SyncException(Kind.DECODE, "Head slot is not a number: " + head.header().message().slot(), e);
        }
    }

    /**
     * GET a URL, retrying while no response is received.
     *
     * @param url the URL
     * @param slot the slot for error reporting, -1 if none
     * @return the first response received, any status
     */
    private HttpResult getWithRetry(String url, long slot) {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                final HttpResult result = transport.get(url);
                LOGGER.log(DEBUG, "GET {0} -> {1}", url, result.statusCode());
                return result;
            } catch (IOException e) {
                lastFailure = e;
                LOGGER.log(
                        WARNING,
                        "GET {0} failed on attempt {1} of {2}: {3}",
                        url,
                        attempt,
                        retryPolicy.maxAttempts(),
                        e.toString());
                if (attempt < retryPolicy.maxAttempts()) {
                    pause(slot);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SyncException(Kind.INTERRUPTED, slot, "Interrupted while fetching " + url, e);
            }
        }
        throw new SyncException(
                Kind.RETRY_EXHAUSTED,
                slot,
                "%d retries failed for %s".formatted(retryPolicy.maxAttempts(), url),
                lastFailure);
    }

    private void pause(long slot) {
        try {
            sleeper.sleep(retryPolicy.delay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(Kind.INTERRUPTED, slot, "Interrupted during retry back-off", e);
        }
    }

    private static <T> T decode(HttpResult result, Class<T> type, long slot) {
        if (result.statusCode() != HttpResult.OK) {
            throw new SyncException(Kind.DECODE, slot, "Unexpected HTTP status %d: %s"
                    .formatted(result.statusCode(), abbreviate(result.body())));
        }
        final T value;
        try {
            value = BeaconJson.GSON.fromJson(result.body(), type);
        } catch (JsonParseException e) {
            throw new SyncException(Kind.DECODE, slot, "Cannot decode " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new SyncException(Kind.DECODE, slot, "Empty body for " + type.getSimpleName());
        }
        return value;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
