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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.statuswatch.poller.common.ValueUtils;
import org.statuswatch.poller.exception.PreprocessParseException;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.model.StatusCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer for Atlassian Statuspage {@code /api/v2/summary.json} and
 * {@code /api/v2/components.json} responses. Component groups are skipped,
 * only their member components are counted.
 */
@ApplicationScoped
public class StatuspageStatusNormalizer implements StatusNormalizer {

    public static final String TARGET = "statuspage";

    private static final String VENDOR = "Statuspage";

    private final ObjectMapper objectMapper;

    @Inject
    public StatuspageStatusNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    public List<ServiceStatus> normalize(String body) {
        JsonNode root = JsonBodies.readObject(objectMapper, body, VENDOR);
        if (!root.path("components").isArray()) {
            throw new PreprocessParseException(VENDOR + " response has no 'components' array");
        }

        List<ServiceStatus> services = new ArrayList<>();
        for (JsonNode component : JsonBodies.objects(root, "components", VENDOR)) {
            if (component.path("group").asBoolean(false)) {
                continue;
            }
            String name = ValueUtils.getOrUnknown(ValueUtils.asText(component.get("name")));
            String rawStatus = ValueUtils.asText(component.get("status"));
            StatusCategory category = categorize(JsonBodies.statusKey(component.get("status")));
            services.add(ServiceStatus.builder()
                    .id(ValueUtils.asText(component.get("id")))
                    .name(name)
                    .rawStatus(rawStatus)
                    .category(category)
                    .severity(severity(category))
                    .build());
        }
        return services;
    }

    static StatusCategory categorize(String status) {
        return switch (status) {
            case "operational" -> StatusCategory.OK;
            case "degraded_performance", "partial_outage" -> StatusCategory.DEGRADED;
            case "major_outage" -> StatusCategory.OUTAGE;
            case "under_maintenance" -> StatusCategory.RECOVERING;
            default -> StatusCategory.INVESTIGATING;
        };
    }

    private static int severity(StatusCategory category) {
        return switch (category) {
            case OK -> 0;
            case RECOVERING, INVESTIGATING -> 1;
            case DEGRADED -> 2;
            case OUTAGE -> 3;
        };
    }
}
