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
package org.statuswatch.poller.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;

import java.io.IOException;

/**
 * Produces the shared HTTP client used for polling.
 *
 * <p>The client keeps a connection pool for transport-level reuse only.
 * Automatic retries are disabled: the poller owns the retry policy.
 */
@Slf4j
@ApplicationScoped
public class HttpClientFactory {

    private static final int MAX_CONNECTIONS = 50;
    private static final int MAX_CONNECTIONS_PER_ROUTE = 10;

    @Produces
    @Singleton
    CloseableHttpClient httpClient() {
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(MAX_CONNECTIONS);
        manager.setDefaultMaxPerRoute(MAX_CONNECTIONS_PER_ROUTE);
        log.debug("Created pooled HTTP client (max {} connections, {} per route)",
                MAX_CONNECTIONS, MAX_CONNECTIONS_PER_ROUTE);
        return HttpClients.custom()
                .setConnectionManager(manager)
                .disableAutomaticRetries()
                .build();
    }

    void close(@Disposes CloseableHttpClient client) {
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Failed to close HTTP client: {}", e.getMessage());
        }
    }
}
