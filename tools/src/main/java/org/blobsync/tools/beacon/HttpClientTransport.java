// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link BeaconApiTransport} backed by the JDK {@link HttpClient}. The client is shared by all fetch tasks.
 */
public final class HttpClientTransport implements BeaconApiTransport {
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    public HttpClientTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpClientTransport(@NonNull HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public HttpResult get(@NonNull String url) throws IOException, InterruptedException {
        final HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/json")
                .GET()
                .build();
        final HttpResponse<String> response =
                httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new HttpResult(response.statusCode(), response.body());
    }
}
