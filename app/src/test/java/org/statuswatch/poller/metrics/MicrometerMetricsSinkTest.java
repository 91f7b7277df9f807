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
package org.statuswatch.poller.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.statuswatch.poller.model.Metric;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MicrometerMetricsSinkTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(registry);
    }

    @Test
    void testEmit_CounterAccumulates() {
        Metric failed = Metric.counter("Observability/Poller", "PollFailed", 1, Map.of("AppName", "github"));

        sink.emit(failed);
        sink.emit(failed);

        Counter counter = registry.get("Observability/Poller:PollFailed").tag("AppName", "github").counter();
        assertEquals(2.0, counter.count());
    }

    @Test
    void testEmit_GaugeHoldsLastValue() {
        Map<String, String> dimensions = Map.of("AppName", "github");

        sink.emit(Metric.gauge("Observability/SaaS", "OverallAvailabilityPercent", 80, Metric.Unit.PERCENT, dimensions));
        sink.emit(Metric.gauge("Observability/SaaS", "OverallAvailabilityPercent", 95.5, Metric.Unit.PERCENT, dimensions));

        Gauge gauge = registry.get("Observability/SaaS:OverallAvailabilityPercent").tag("AppName", "github").gauge();
        assertEquals(95.5, gauge.value());
        assertEquals("percent", gauge.getId().getBaseUnit());
        assertEquals(1, registry.find("Observability/SaaS:OverallAvailabilityPercent").gauges().size());
    }

    @Test
    void testEmit_GaugesSeparatedByDimensions() {
        sink.emit(Metric.gauge("Observability/SaaS", "CriticalScore", 11, Metric.Unit.NONE, Map.of("AppName", "a")));
        sink.emit(Metric.gauge("Observability/SaaS", "CriticalScore", 3, Metric.Unit.NONE, Map.of("AppName", "b")));

        assertEquals(11.0, registry.get("Observability/SaaS:CriticalScore").tag("AppName", "a").gauge().value());
        assertEquals(3.0, registry.get("Observability/SaaS:CriticalScore").tag("AppName", "b").gauge().value());
    }
}
