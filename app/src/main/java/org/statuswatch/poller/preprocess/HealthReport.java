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

import lombok.Builder;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.model.StatusCategory;

import java.time.Instant;
import java.util.List;

/**
 * Normalized health record of one successful poll.
 *
 * @param appName    Application name
 * @param observedAt When the record was produced
 * @param provider   Data source, e.g. {@code microsoft-graph}
 * @param httpStatus Status of the polled response
 * @param overall    Worst category across services
 * @param kpis       Aggregate indicators
 * @param services   Per-service statuses
 * @param version    Record format version
 */
@Builder
public record HealthReport(String appName,
                           Instant observedAt,
                           String provider,
                           Integer httpStatus,
                           StatusCategory overall,
                           HealthKpis kpis,
                           List<ServiceStatus> services,
                           String version) {

    public static final String CURRENT_VERSION = "1.0";

    public HealthReport {
        services = services == null ? List.of() : List.copyOf(services);
        version = version == null ? CURRENT_VERSION : version;
    }

    public int impactedServicesCount() {
        return kpis.impactedServices();
    }
}
