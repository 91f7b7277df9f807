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

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HttpExchange} backed by the shared Apache HttpClient 5 instance.
 *
 * <p>Each attempt runs on a worker thread while the caller waits at most the
 * attempt timeout. On timeout or interruption of the caller the request is
 * aborted, which closes its connection and unblocks the worker.
 */
@Slf4j
@ApplicationScoped
public class ApacheHttpExchange implements HttpExchange {

    private final CloseableHttpClient httpClient;
    private final ExecutorService workers;

    @Inject
    public ApacheHttpExchange(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
        this.workers = Executors.newCachedThreadPool(new AttemptThreadFactory());
    }

    @Override
    public HttpResponseData send(HttpRequestSpec spec, Duration timeout) throws IOException, InterruptedException {
        HttpUriRequestBase request = new HttpUriRequestBase(spec.method(), spec.uri());
        spec.headers().forEach(request::addHeader);
        Timeout attemptTimeout = Timeout.ofMilliseconds(timeout.toMillis());
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(attemptTimeout)
                .setResponseTimeout(attemptTimeout)
                .build());

        Future<HttpResponseData> future = workers.submit(() -> httpClient.execute(request, this::toResponseData));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abort(request, future);
            throw new SocketTimeoutException("Request timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            abort(request, future);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException(cause.getMessage(), cause);
        }
    }

    private HttpResponseData toResponseData(ClassicHttpResponse response) throws IOException, ParseException {
        HttpEntity entity = response.getEntity();
        String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        return new HttpResponseData(response.getCode(), body);
    }

    private void abort(HttpUriRequestBase request, Future<?> future) {
        log.debug("Cancelling in-flight request {} {}", request.getMethod(), request.getRequestUri());
        request.cancel();
        future.cancel(true);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    private static final class AttemptThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "poll-attempt-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
