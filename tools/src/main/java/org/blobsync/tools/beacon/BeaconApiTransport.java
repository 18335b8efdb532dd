// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Performs HTTP GET requests against a beacon node API.
 */
@FunctionalInterface
public interface BeaconApiTransport {

    /**
     * Issue a GET request and read the whole response.
     *
     * @param url the absolute URL
     * @return the status and body of the response, whatever the status
     * @throws IOException if no response was received, for example on connection refused or timeout
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    HttpResult get(@NonNull String url) throws IOException, InterruptedException;
}
