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

import org.junit.jupiter.api.Test;
import org.statuswatch.poller.model.Metric;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.model.StatusCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KpiCalculatorTest {

    private static List<ServiceStatus> services(int ok, int outage, int degraded, int investigating, int recovering) {
        List<ServiceStatus> services = new ArrayList<>();
        add(services, StatusCategory.OK, ok);
        add(services, StatusCategory.OUTAGE, outage);
        add(services, StatusCategory.DEGRADED, degraded);
        add(services, StatusCategory.INVESTIGATING, investigating);
        add(services, StatusCategory.RECOVERING, recovering);
        return services;
    }

    private static void add(List<ServiceStatus> services, StatusCategory category, int count) {
        for (int i = 0; i < count; i++) {
            services.add(ServiceStatus.of(category.name().toLowerCase() + "-" + i, category));
        }
    }

    @Test
    void testCompute_ReferenceExample() {
        // Setup - 10 services: outage 2, degraded 1, investigating 1, recovering 0, ok 6
        List<ServiceStatus> services = services(6, 2, 1, 1, 0);

        // Execute
        HealthKpis kpis = KpiCalculator.compute(services);

        // Verify
        assertEquals(10, kpis.total());
        assertEquals(6, kpis.ok());
        assertEquals(2, kpis.outage());
        assertEquals(1, kpis.degraded());
        assertEquals(1, kpis.investigating());
        assertEquals(0, kpis.recovering());
        assertEquals(80.0, kpis.availabilityPercent());
        assertEquals(11.0, kpis.criticalScore());
        assertEquals(4, kpis.impactedServices());
    }

    @Test
    void testCompute_RecoveringWeighsHalf() {
        HealthKpis kpis = KpiCalculator.compute(services(0, 0, 0, 0, 3));

        assertEquals(1.5, kpis.criticalScore());
        assertEquals(100.0, kpis.availabilityPercent());
    }

    @Test
    void testCompute_NoServices() {
        HealthKpis kpis = KpiCalculator.compute(List.of());

        assertEquals(0, kpis.total());
        assertEquals(100.0, kpis.availabilityPercent());
        assertEquals(0.0, kpis.criticalScore());
    }

    @Test
    void testCompute_RoundsAvailability() {
        HealthKpis kpis = KpiCalculator.compute(services(2, 1, 0, 0, 0));
        assertEquals(66.67, kpis.availabilityPercent());
    }

    @Test
    void testOverallCategory_WorstPresent() {
        assertEquals(StatusCategory.OK, KpiCalculator.compute(services(3, 0, 0, 0, 0)).overallCategory());
        assertEquals(StatusCategory.RECOVERING, KpiCalculator.compute(services(3, 0, 0, 0, 1)).overallCategory());
        assertEquals(StatusCategory.INVESTIGATING, KpiCalculator.compute(services(3, 0, 0, 1, 1)).overallCategory());
        assertEquals(StatusCategory.DEGRADED, KpiCalculator.compute(services(3, 0, 1, 1, 1)).overallCategory());
        assertEquals(StatusCategory.OUTAGE, KpiCalculator.compute(services(3, 1, 1, 1, 1)).overallCategory());
    }

    @Test
    void testToMetrics_AllCarryAppName() {
        HealthKpis kpis = KpiCalculator.compute(services(6, 2, 1, 1, 0));

        List<Metric> metrics = kpis.toMetrics("Observability/SaaS", "m365");

        assertEquals(List.of("OverallAvailabilityPercent", "ServicesOutageCount", "ServicesDegradedCount",
                        "ServicesRecoveringCount", "ServicesInvestigatingCount", "CriticalScore"),
                metrics.stream().map(Metric::name).toList());
        metrics.forEach(metric -> {
            assertEquals("Observability/SaaS", metric.namespace());
            assertEquals(Map.of("AppName", "m365"), metric.dimensions());
            assertEquals(Metric.Type.GAUGE, metric.type());
        });
        assertEquals(Metric.Unit.PERCENT, metrics.get(0).unit());
        assertEquals(Metric.Unit.COUNT, metrics.get(1).unit());
        assertEquals(Metric.Unit.NONE, metrics.get(5).unit());
        assertEquals(2.0, metrics.get(1).value());
    }
}
