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
package org.statuswatch.poller.preprocess;

import org.statuswatch.poller.model.ServiceStatus;

import java.util.List;

/**
 * Vendor-specific normalization of a status API response.
 *
 * <p>Implementations are CDI beans; the {@link Preprocessor} picks the one whose
 * {@link #target()} matches the application's preprocess target.
 */
public interface StatusNormalizer {

    /**
     * Preprocess target served by this normalizer, e.g. {@code microsoft365}.
     */
    String target();

    /**
     * Data source reported in the health report.
     */
    default String provider() {
        return target();
    }

    /**
     * Normalize a response body into per-service statuses.
     *
     * @param body Response body of a successful poll
     * @return Service statuses, possibly empty
     * @throws org.statuswatch.poller.exception.PreprocessParseException if the body does not match the vendor schema
     */
    List<ServiceStatus> normalize(String body);
}
