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
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.common.ValueUtils;
import org.statuswatch.poller.exception.PreprocessParseException;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.model.StatusCategory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Normalizer for the Microsoft Graph service announcement API.
 *
 * <p>Accepts either {@code {"value": [healthOverview...]}} as returned by
 * {@code /admin/serviceAnnouncement/healthOverviews}, or a combined document
 * {@code {"healthOverviews": [...], "issues": [...]}} where {@code issues} may be
 * omitted. Open issues are attached
 * to their service and raise its severity.
 */
@Slf4j
@ApplicationScoped
public class Microsoft365StatusNormalizer implements StatusNormalizer {

    public static final String TARGET = "microsoft365";

    private static final String VENDOR = "Microsoft Graph";

    private static final Map<String, Mapping> STATUS_MAP = Map.ofEntries(
            entry("serviceoperational", new Mapping(StatusCategory.OK, 0)),
            entry("servicerestored", new Mapping(StatusCategory.OK, 0)),
            entry("resolved", new Mapping(StatusCategory.OK, 0)),
            entry("resolvedexternal", new Mapping(StatusCategory.OK, 0)),
            entry("falsepositive", new Mapping(StatusCategory.OK, 0)),
            entry("postincidentreviewpublished", new Mapping(StatusCategory.OK, 0)),
            entry("investigating", new Mapping(StatusCategory.INVESTIGATING, 2)),
            entry("confirmed", new Mapping(StatusCategory.INVESTIGATING, 2)),
            entry("reported", new Mapping(StatusCategory.INVESTIGATING, 1)),
            entry("investigationsuspended", new Mapping(StatusCategory.INVESTIGATING, 1)),
            entry("restoringservice", new Mapping(StatusCategory.RECOVERING, 1)),
            entry("extendedrecovery", new Mapping(StatusCategory.RECOVERING, 1)),
            entry("verifyingservice", new Mapping(StatusCategory.RECOVERING, 1)),
            entry("mitigated", new Mapping(StatusCategory.RECOVERING, 1)),
            entry("mitigatedexternal", new Mapping(StatusCategory.RECOVERING, 1)),
            entry("servicedegradation", new Mapping(StatusCategory.DEGRADED, 2)),
            entry("serviceinterruption", new Mapping(StatusCategory.OUTAGE, 3)));

    // Statuses outside the table, including Graph's "unknownFutureValue"
    private static final Mapping UNKNOWN_STATUS = new Mapping(StatusCategory.INVESTIGATING, 1);

    private static final Map<String, Integer> ISSUE_SEVERITY = Map.of(
            "informational", 0,
            "low", 1,
            "medium", 2,
            "high", 3,
            "critical", 3);
    private static final int UNKNOWN_ISSUE_SEVERITY = 1;

    private static final Set<String> CLOSED_ISSUE_STATUSES = Set.of("servicerestored", "resolved", "closed");

    private final ObjectMapper objectMapper;

    @Inject
    public Microsoft365StatusNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    public String provider() {
        return "microsoft-graph";
    }

    @Override
    public List<ServiceStatus> normalize(String body) {
        JsonNode root = JsonBodies.readObject(objectMapper, body, VENDOR);

        List<JsonNode> overviews;
        List<JsonNode> issues;
        if (root.has("healthOverviews") || root.has("issues")) {
            if (!root.path("healthOverviews").isArray()) {
                throw new PreprocessParseException(VENDOR + " response has no 'healthOverviews' array");
            }
            overviews = JsonBodies.objects(root, "healthOverviews", VENDOR);
            issues = JsonBodies.objects(root, "issues", VENDOR);
        } else if (root.path("value").isArray()) {
            overviews = JsonBodies.objects(root, "value", VENDOR);
            issues = List.of();
        } else {
            throw new PreprocessParseException(VENDOR + " response has neither 'value' nor 'healthOverviews'");
        }

        Map<String, List<JsonNode>> openIssuesByService = new HashMap<>();
        for (JsonNode issue : issues) {
            String service = firstText(issue, "service", "affectedWorkload");
            if (service != null && isOpen(issue)) {
                openIssuesByService.computeIfAbsent(service, k -> new ArrayList<>()).add(issue);
            }
        }

        List<ServiceStatus> services = new ArrayList<>(overviews.size());
        for (JsonNode overview : overviews) {
            String name = ValueUtils.getOrUnknown(firstText(overview, "service", "id"));
            String rawStatus = ValueUtils.asText(overview.get("status"));
            Mapping mapping = STATUS_MAP.getOrDefault(JsonBodies.statusKey(overview.get("status")), UNKNOWN_STATUS);
            if (mapping == UNKNOWN_STATUS) {
                log.debug("Unmapped Microsoft 365 status '{}' for service '{}'", rawStatus, name);
            }

            List<JsonNode> openIssues = openIssuesByService.getOrDefault(name, List.of());
            int highestIssueSeverity = 0;
            for (JsonNode issue : openIssues) {
                highestIssueSeverity = Math.max(highestIssueSeverity, issueSeverity(issue));
            }

            services.add(ServiceStatus.builder()
                    .id(ValueUtils.asText(overview.get("id")))
                    .name(name)
                    .rawStatus(rawStatus)
                    .category(mapping.category())
                    .severity(Math.max(mapping.severity(), highestIssueSeverity))
                    .openIssues(openIssues.size())
                    .highestIncidentSeverity(highestIssueSeverity)
                    .build());
        }
        return services;
    }

    private static boolean isOpen(JsonNode issue) {
        return !CLOSED_ISSUE_STATUSES.contains(JsonBodies.statusKey(issue.get("status")));
    }

    private static int issueSeverity(JsonNode issue) {
        String severity = ValueUtils.asText(issue.get("severity"));
        if (severity == null) {
            return UNKNOWN_ISSUE_SEVERITY;
        }
        return ISSUE_SEVERITY.getOrDefault(severity.toLowerCase(Locale.ROOT), UNKNOWN_ISSUE_SEVERITY);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String text = ValueUtils.asText(node.get(field));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private record Mapping(StatusCategory category, int severity) {
    }
}
