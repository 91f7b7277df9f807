/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.statuswatch.poller.poll;

import com.sun.net.httpserver.HttpServer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApacheHttpExchangeTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private CloseableHttpClient httpClient;
    private ApacheHttpExchange exchange;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/status", http -> reply(http, 200,
                "auth=" + http.getRequestHeaders().getFirst("Authorization")
                        + ";query=" + http.getRequestURI().getRawQuery()));
        server.createContext("/busy", http -> reply(http, 503, "busy"));
        server.createContext("/slow", http -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply(http, 200, "late");
        });
        server.start();

        httpClient = HttpClients.createDefault();
        exchange = new ApacheHttpExchange(httpClient);
    }

    @AfterEach
    void tearDown() throws IOException {
        exchange.shutdown();
        httpClient.close();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private static void reply(com.sun.net.httpserver.HttpExchange http, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        http.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = http.getResponseBody()) {
            out.write(bytes);
        }
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + pathAndQuery);
    }

    @Test
    void testSend_ReturnsStatusAndBody() throws Exception {
        HttpRequestSpec request = new HttpRequestSpec("GET", uri("/status?a=x%26y&b=two%20words"),
                Map.of("Authorization", "Bearer abc"));

        HttpResponseData response = exchange.send(request, Duration.ofSeconds(5));

        assertEquals(200, response.status());
        assertTrue(response.isSuccessful());
        assertEquals("auth=Bearer abc;query=a=x%26y&b=two%20words", response.body());
    }

    @Test
    void testSend_ErrorStatusIsAResponse() throws Exception {
        HttpResponseData response = exchange.send(new HttpRequestSpec("GET", uri("/busy"), Map.of()),
                Duration.ofSeconds(5));

        assertEquals(503, response.status());
        assertFalse(response.isSuccessful());
        assertEquals("busy", response.body());
    }

    @Test
    void testSend_TimeoutCancelsAttempt() {
        HttpRequestSpec request = new HttpRequestSpec("GET", uri("/slow"), Map.of());

        long started = System.nanoTime();
        assertThrows(InterruptedIOException.class, () -> exchange.send(request, Duration.ofMillis(200)));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(elapsedMillis < 2500, "attempt should be cut off at the timeout, took " + elapsedMillis + " ms");
    }

    @Test
    void testSend_ConnectionRefused() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        HttpRequestSpec request = new HttpRequestSpec("GET", URI.create("http://127.0.0.1:" + port + "/"), Map.of());

        assertThrows(IOException.class, () -> exchange.send(request, Duration.ofSeconds(2)));
    }
}
