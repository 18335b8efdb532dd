// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

/**
 * Status and body of a completed HTTP exchange.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, decoded as UTF-8
 */
public record HttpResult(int statusCode, String body) {
    /** HTTP 200. */
    public static final int OK = 200;
    /** HTTP 404. */
    public static final int NOT_FOUND = 404;
}
