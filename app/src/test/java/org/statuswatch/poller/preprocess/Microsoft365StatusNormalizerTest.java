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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.statuswatch.poller.exception.PreprocessParseException;
import org.statuswatch.poller.model.ErrorKind;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.model.StatusCategory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Microsoft365StatusNormalizerTest {

    private final Microsoft365StatusNormalizer normalizer = new Microsoft365StatusNormalizer(new ObjectMapper());

    @Test
    void testTargetAndProvider() {
        assertEquals("microsoft365", normalizer.target());
        assertEquals("microsoft-graph", normalizer.provider());
    }

    @Test
    void testNormalize_ValueEnvelope() {
        String body = """
                {"value": [
                  {"id": "Exchange", "service": "Exchange Online", "status": "serviceOperational"},
                  {"id": "Teams", "service": "Microsoft Teams", "status": "serviceDegradation"},
                  {"id": "SharePoint", "service": "SharePoint Online", "status": "Service Interruption"},
                  {"id": "OneDrive", "service": "OneDrive for Business", "status": "restoringService"},
                  {"id": "Intune", "service": "Microsoft Intune", "status": "investigating"},
                  {"id": "Yammer", "service": "Yammer", "status": "unknownFutureValue"}
                ]}
                """;

        List<ServiceStatus> services = normalizer.normalize(body);

        assertEquals(6, services.size());
        assertEquals(StatusCategory.OK, services.get(0).category());
        assertEquals("Exchange", services.get(0).id());
        assertEquals("Exchange Online", services.get(0).name());
        assertEquals("serviceOperational", services.get(0).rawStatus());
        assertEquals(StatusCategory.DEGRADED, services.get(1).category());
        assertEquals(StatusCategory.OUTAGE, services.get(2).category());
        assertEquals(3, services.get(2).severity());
        assertEquals(StatusCategory.RECOVERING, services.get(3).category());
        assertEquals(StatusCategory.INVESTIGATING, services.get(4).category());
        assertEquals(StatusCategory.INVESTIGATING, services.get(5).category());
    }

    @Test
    void testNormalize_OpenIssuesRaiseSeverity() {
        String body = """
                {
                  "healthOverviews": [
                    {"id": "Exchange", "service": "Exchange Online", "status": "serviceOperational"},
                    {"id": "Teams", "service": "Microsoft Teams", "status": "serviceOperational"}
                  ],
                  "issues": [
                    {"id": "EX1", "service": "Exchange Online", "status": "investigating", "severity": "High"},
                    {"id": "EX2", "affectedWorkload": "Exchange Online", "status": "confirmed", "severity": "low"},
                    {"id": "TM1", "service": "Microsoft Teams", "status": "serviceRestored", "severity": "critical"}
                  ]
                }
                """;

        List<ServiceStatus> services = normalizer.normalize(body);

        ServiceStatus exchange = services.get(0);
        assertEquals(StatusCategory.OK, exchange.category());
        assertEquals(2, exchange.openIssues());
        assertEquals(3, exchange.highestIncidentSeverity());
        assertEquals(3, exchange.severity());

        ServiceStatus teams = services.get(1);
        assertEquals(0, teams.openIssues());
        assertEquals(0, teams.severity());
    }

    @Test
    void testNormalize_UnknownIssueSeverityCountsAsLow() {
        String body = """
                {"healthOverviews": [{"service": "Exchange Online", "status": "serviceOperational"}],
                 "issues": [{"service": "Exchange Online", "status": "reported", "severity": "unusual"}]}
                """;

        ServiceStatus exchange = normalizer.normalize(body).get(0);

        assertEquals(1, exchange.highestIncidentSeverity());
        assertEquals("Exchange Online", exchange.id());
    }

    @Test
    void testNormalize_CombinedDocumentWithoutOverviews() {
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("{\"issues\": []}"));
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("{\"healthOverviews\": null}"));
        assertThrows(PreprocessParseException.class,
                () -> normalizer.normalize("{\"healthOverviews\": {}, \"issues\": []}"));
    }

    @Test
    void testNormalize_OverviewsWithoutIssues() {
        String body = "{\"healthOverviews\": [{\"service\": \"Exchange Online\", \"status\": \"serviceOperational\"}]}";

        List<ServiceStatus> services = normalizer.normalize(body);

        assertEquals(1, services.size());
        assertEquals(0, services.get(0).openIssues());
    }

    @Test
    void testNormalize_EmptyValue() {
        assertTrue(normalizer.normalize("{\"value\": []}").isEmpty());
    }

    @Test
    void testNormalize_InvalidJson() {
        PreprocessParseException e = assertThrows(PreprocessParseException.class,
                () -> normalizer.normalize("<html>maintenance</html>"));
        assertEquals(ErrorKind.PREPROCESS_PARSE_ERROR, e.getKind());
    }

    @Test
    void testNormalize_UnexpectedSchema() {
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("{\"components\": []}"));
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("{\"value\": \"none\"}"));
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("[]"));
    }

    @Test
    void testNormalize_NonObjectEntries() {
        assertThrows(PreprocessParseException.class, () -> normalizer.normalize("{\"healthOverviews\": [1, 2]}"));
    }
}
