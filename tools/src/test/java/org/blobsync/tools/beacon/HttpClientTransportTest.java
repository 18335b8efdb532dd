// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.blobsync.tools.beacon.model.BlobSidecarsResponse;
import org.blobsync.tools.utils.TestSidecars;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Tests {@link HttpClientTransport} and {@link BeaconApiClient} against a local HTTP server.
 */
@Timeout(value = 10, unit = TimeUnit.SECONDS)
class HttpClientTransportTest {
    private HttpServer server;
    private String baseUrl;
    private volatile String lastAcceptHeader;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/eth/v1/beacon/blob_sidecars/", exchange -> {
            lastAcceptHeader = exchange.getRequestHeaders().getFirst("Accept");
            final String slot = exchange.getRequestURI().getPath().replaceAll(".*/", "");
            if (slot.equals("10")) {
                respond(exchange, 200, BeaconJson.GSON.toJson(new BlobSidecarsResponse(TestSidecars.sidecars(10, 1))));
            } else {
                respond(exchange, 404, "{\"code\":404,\"message\":\"NOT_FOUND: blob sidecars\"}");
            }
        });
        server.start();
        baseUrl = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("Returns status and body, asking for JSON")
    void returnsStatusAndBody() throws Exception {
        final HttpResult result = new HttpClientTransport().get(BeaconApiUrls.blobSidecars(baseUrl, 11));
        assertEquals(404, result.statusCode());
        assertEquals("{\"code\":404,\"message\":\"NOT_FOUND: blob sidecars\"}", result.body());
        assertEquals("application/json", lastAcceptHeader);
    }

    @Test
    @DisplayName("Client decodes sidecars served over HTTP")
    void clientOverHttp() {
        final BeaconApiClient client = new BeaconApiClient(baseUrl, new HttpClientTransport(), RetryPolicy.DEFAULT);
        assertEquals(TestSidecars.sidecars(10, 1), client.fetchBlobSidecars(10));
        assertEquals(List.of(), client.fetchBlobSidecars(11));
    }

    @Test
    @DisplayName("Connection failure surfaces as IOException")
    void connectionRefused() throws IOException {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        final String url = BeaconApiUrls.blobSidecars("http://127.0.0.1:" + closedPort, 10);
        assertThrows(IOException.class, () -> new HttpClientTransport().get(url));
    }
}
