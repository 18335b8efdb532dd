// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Beacon API resource paths and URL joining.
 */
public final class BeaconApiUrls {
    /** Blob sidecars of one slot, the slot number is appended. */
    public static final String BLOB_SIDECARS_PATH = "eth/v1/beacon/blob_sidecars/";
    /** Headers of the chain head. */
    public static final String HEADERS_PATH = "eth/v1/beacon/headers";

    private BeaconApiUrls() {}

    /**
     * Join a base URL and a relative path so that exactly one slash separates them.
     *
     * @param baseUrl the API base, with or without trailing slash
     * @param path the relative path, without leading slash
     * @return the joined URL
     */
    public static String resolve(@NonNull String baseUrl, @NonNull String path) {
        return baseUrl.endsWith("/") ? baseUrl + path : baseUrl + "/" + path;
    }

    public static String blobSidecars(@NonNull String baseUrl, long slot) {
        return resolve(baseUrl, BLOB_SIDECARS_PATH + slot);
    }

    public static String headers(@NonNull String baseUrl) {
        return resolve(baseUrl, HEADERS_PATH);
    }

    public static String header(@NonNull String baseUrl, long slot) {
        return resolve(baseUrl, HEADERS_PATH + "/" + slot);
    }
}
