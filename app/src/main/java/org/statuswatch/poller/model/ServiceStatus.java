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
package org.statuswatch.poller.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Normalized status of one vendor service.
 *
 * @param id                      Vendor identifier of the service
 * @param name                    Display name
 * @param rawStatus               Status string as reported by the vendor
 * @param category                Normalized category
 * @param severity                Severity 0..3 combining status and open incidents
 * @param openIssues              Number of open incidents attached to the service
 * @param highestIncidentSeverity Highest severity among open incidents (0 when none)
 */
@Builder
public record ServiceStatus(String id,
                            String name,
                            String rawStatus,
                            StatusCategory category,
                            int severity,
                            int openIssues,
                            int highestIncidentSeverity) {

    public ServiceStatus {
        Objects.requireNonNull(name, "Service name must not be null");
        Objects.requireNonNull(category, "Service category must not be null");
        id = id == null ? name : id;
    }

    public static ServiceStatus of(String name, StatusCategory category) {
        return ServiceStatus.builder().name(name).category(category).build();
    }
}
