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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.common.Constants;
import org.statuswatch.poller.config.PollerConfig;
import org.statuswatch.poller.exception.PollerException;
import org.statuswatch.poller.exception.SecretResolutionException;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.AttemptRecord;
import org.statuswatch.poller.model.ErrorKind;
import org.statuswatch.poller.model.PollResult;
import org.statuswatch.poller.model.RetryPolicy;
import org.statuswatch.poller.model.SecretRef;
import org.statuswatch.poller.store.SecretResolver;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes one poll of a monitored endpoint with retry and backoff.
 *
 * <p>Failures of the monitored endpoint never escape as exceptions: they are
 * returned as a {@link PollResult} with {@code ok=false} and an {@link ErrorKind}.
 * Only secret store infrastructure errors and interruption propagate.
 *
 * <p><b>Retry:</b> the attempt counter starts at 1 and is shared by HTTP status
 * retries, timeouts and connection errors. After a failed attempt {@code n}
 * the poller waits {@link BackoffStrategy#delay(double, int)} before the next one,
 * until the policy's {@code maxAttempts} is reached.
 */
@Slf4j
@ApplicationScoped
public class Poller {

    private final SecretResolver secretResolver;
    private final HttpExchange httpExchange;
    private final RequestFactory requestFactory;
    private final PollerConfig pollerConfig;
    private final Sleeper sleeper;
    private final Clock clock;

    @Inject
    public Poller(SecretResolver secretResolver,
                  HttpExchange httpExchange,
                  RequestFactory requestFactory,
                  PollerConfig pollerConfig) {
        this(secretResolver, httpExchange, requestFactory, pollerConfig, Sleeper.THREAD, Clock.systemUTC());
    }

    Poller(SecretResolver secretResolver,
           HttpExchange httpExchange,
           RequestFactory requestFactory,
           PollerConfig pollerConfig,
           Sleeper sleeper,
           Clock clock) {
        this.secretResolver = secretResolver;
        this.httpExchange = httpExchange;
        this.requestFactory = requestFactory;
        this.pollerConfig = pollerConfig;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Resolve the credential for the application and poll its endpoint.
     *
     * @param appConfig Application configuration
     * @return Poll result; {@code ok=false} with zero attempts when the credential cannot be resolved
     * @throws org.statuswatch.poller.exception.SecretStoreException if the secret store is unavailable
     * @throws InterruptedException                                 if the execution was cancelled
     */
    public PollResult poll(AppConfig appConfig) throws InterruptedException {
        String credential = null;
        String authSource = null;

        SecretRef secretRef = appConfig.secretRef();
        if (secretRef != null) {
            try {
                credential = secretResolver.resolve(secretRef);
                authSource = Constants.AUTH_SOURCE_SECRET_PREFIX + secretRef.name();
            } catch (SecretResolutionException e) {
                log.warn("Poll for '{}' not attempted: {}", appConfig.appName(), e.getMessage());
                return PollResult.failedBeforeRequest(e.getKind(), e.getMessage());
            }
        } else if (pollerConfig.fallbackApiKey().isPresent()) {
            log.debug("No secret configured for '{}', using fallback API key", appConfig.appName());
            credential = pollerConfig.fallbackApiKey().get();
            authSource = Constants.AUTH_SOURCE_FALLBACK;
        }

        return execute(appConfig, credential, authSource);
    }

    /**
     * Poll the endpoint with an already resolved credential.
     *
     * @param appConfig  Application configuration
     * @param credential Credential, null for unauthenticated requests
     * @return Poll result
     * @throws InterruptedException if the execution was cancelled during an attempt or a backoff wait
     */
    public PollResult execute(AppConfig appConfig, String credential) throws InterruptedException {
        return execute(appConfig, credential, null);
    }

    private PollResult execute(AppConfig appConfig, String credential, String authSource) throws InterruptedException {
        String appName = appConfig.appName();
        HttpRequestSpec request;
        try {
            request = requestFactory.build(appConfig, credential);
        } catch (PollerException e) {
            log.warn("Poll for '{}' not attempted: {}", appName, e.getMessage());
            return PollResult.failedBeforeRequest(e.getKind(), e.getMessage());
        }
        log.info("Polling '{}': {} {} headers={}", appName, request.method(), request.uri(),
                HeaderRedactor.redact(request.headers(), appConfig.authHeaderName()));

        RetryPolicy policy = appConfig.retryPolicy();
        boolean debug = pollerConfig.debug();
        List<AttemptRecord> attempts = new ArrayList<>();
        long started = clock.millis();

        int attempt = 0;
        HttpResponseData response;
        ErrorKind errorKind;
        String lastError;
        while (true) {
            attempt++;
            Instant attemptStart = clock.instant();
            boolean retryable;
            try {
                response = httpExchange.send(request, appConfig.timeout());
                if (debug) {
                    attempts.add(AttemptRecord.response(attempt, response.status(), attemptStart, elapsedSince(attemptStart)));
                }
                if (response.isSuccessful()) {
                    errorKind = null;
                    lastError = null;
                    break;
                }
                retryable = policy.isRetryable(response.status());
                errorKind = retryable ? ErrorKind.TRANSIENT_HTTP_ERROR : ErrorKind.PERMANENT_HTTP_ERROR;
                lastError = "HTTP " + response.status();
            } catch (IOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Poll for '" + appName + "' interrupted");
                }
                response = null;
                retryable = true;
                errorKind = e instanceof InterruptedIOException ? ErrorKind.TIMEOUT : ErrorKind.CONNECTION_ERROR;
                lastError = HeaderRedactor.scrub(describe(e), credential);
                if (debug) {
                    attempts.add(AttemptRecord.error(attempt, lastError, attemptStart, elapsedSince(attemptStart)));
                }
            }

            if (!retryable || attempt >= policy.maxAttempts()) {
                break;
            }
            Duration delay = pollerConfig.backoffStrategy().delay(policy.backoff(), attempt);
            log.info("Attempt {}/{} for '{}' failed ({}), retrying in {} ms",
                    attempt, policy.maxAttempts(), appName, lastError, delay.toMillis());
            sleeper.sleep(delay);
        }

        return buildResult(appName, response, errorKind, lastError, attempt, attempts, started, authSource);
    }

    private PollResult buildResult(String appName,
                                   HttpResponseData response,
                                   ErrorKind errorKind,
                                   String lastError,
                                   int attemptCount,
                                   List<AttemptRecord> attempts,
                                   long started,
                                   String authSource) {
        boolean ok = errorKind == null;
        String body = response == null ? "" : response.body();
        boolean truncated = body.length() > pollerConfig.maxBodyChars();
        if (truncated) {
            body = body.substring(0, pollerConfig.maxBodyChars());
        }
        long elapsed = clock.millis() - started;
        Integer status = response == null ? null : response.status();

        String error = null;
        if (ok) {
            log.info("Poll for '{}' succeeded with HTTP {} after {} attempt(s) in {} ms",
                    appName, status, attemptCount, elapsed);
        } else {
            error = "Poller failed after " + attemptCount + (attemptCount == 1 ? " attempt: " : " attempts: ") + lastError;
            log.warn("Poll for '{}' failed ({}): {}", appName, errorKind, error);
        }

        return PollResult.builder()
                .ok(ok)
                .statusCode(status)
                .body(body)
                .bodyTruncated(truncated)
                .elapsedMillis(elapsed)
                .attemptCount(attemptCount)
                .attempts(attempts)
                .errorKind(errorKind)
                .error(error)
                .authSource(authSource)
                .build();
    }

    private long elapsedSince(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }
}
