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
package org.statuswatch.poller.store;

import org.statuswatch.poller.model.AppConfig;

/**
 * Read-only accessor for per-application poll configuration.
 *
 * <p>Implementations must read the backing store on every call: an operator
 * update has to be visible on the very next execution.
 */
public interface ConfigStore {

    /**
     * Resolve the configuration of an application.
     *
     * @param appName Application name (never null)
     * @return Parsed configuration (never null)
     * @throws org.statuswatch.poller.exception.ConfigNotFoundException if no item exists
     * @throws org.statuswatch.poller.exception.ConfigFormatException   if the item cannot be read or parsed
     */
    AppConfig resolve(String appName);

    /**
     * Whether the backing store can currently be read. Used by the readiness check.
     *
     * @return {@code true} if available
     */
    default boolean isAvailable() {
        return true;
    }
}
