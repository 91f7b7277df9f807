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
package org.statuswatch.poller.workflow;

import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.PollResult;

import java.util.Objects;

/**
 * State accumulated by one execution. Starts with the application name and
 * gains the config, then the poll result. A field, once set, is never replaced.
 *
 * @param appName Application name
 * @param config  Configuration, null before config lookup
 * @param poll    Poll result, null before polling
 */
public record ExecutionContext(String appName, AppConfig config, PollResult poll) {

    public ExecutionContext {
        Objects.requireNonNull(appName, "appName must not be null");
    }

    public static ExecutionContext start(String appName) {
        return new ExecutionContext(appName, null, null);
    }

    public ExecutionContext withConfig(AppConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (this.config != null) {
            throw new IllegalStateException("Config already set for '" + appName + "'");
        }
        return new ExecutionContext(appName, config, poll);
    }

    public ExecutionContext withPoll(PollResult poll) {
        Objects.requireNonNull(poll, "poll must not be null");
        if (this.poll != null) {
            throw new IllegalStateException("Poll result already set for '" + appName + "'");
        }
        return new ExecutionContext(appName, config, poll);
    }
}
