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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import org.statuswatch.poller.poll.BackoffStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the poller: authentication defaults, retry defaults and result shaping.
 */
@ConfigMapping(prefix = "app.poller")
public interface PollerConfig {

    /**
     * Header carrying the credential when the config item does not name one.
     *
     * @return Header name (default: Authorization)
     */
    @WithDefault("Authorization")
    String defaultAuthHeader();

    /**
     * Prefix prepended to the credential when the config item does not set one.
     *
     * @return Prefix (default: "Bearer ")
     */
    @WithDefault("Bearer ")
    String defaultAuthPrefix();

    /**
     * Whether poll results include per-attempt debug records.
     *
     * @return true to record attempts (default: false)
     */
    @WithDefault("false")
    boolean debug();

    /**
     * Maximum number of body characters kept in a poll result,
     * bounded by downstream payload-size limits.
     *
     * @return Maximum body length (default: 240000)
     */
    @WithDefault("240000")
    int maxBodyChars();

    @WithDefault("10s")
    Duration defaultTimeout();

    @WithDefault("3")
    int defaultMaxAttempts();

    @WithDefault("1.5")
    double defaultBackoff();

    @WithDefault("429,500,502,503,504")
    List<Integer> defaultRetryOn();

    /**
     * How the backoff factor turns into a delay between attempts.
     *
     * @return Backoff strategy (default: LINEAR, i.e. backoff * attempt)
     */
    @WithDefault("linear")
    BackoffStrategy backoffStrategy();

    /**
     * Credential used when a config item names no secret. Local development only.
     *
     * @return Fallback API key, if configured
     */
    Optional<String> fallbackApiKey();
}
