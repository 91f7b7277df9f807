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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.common.MetricNameBuilder;
import org.statuswatch.poller.model.Metric;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link MetricsSink} publishing to the Micrometer registry.
 *
 * <p>Meter names are {@code <namespace>:<name>} and dimensions become tags.
 * Counters accumulate. Gauges hold the last emitted value per name and tag set.
 */
@Slf4j
@ApplicationScoped
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry registry;
    private final Map<String, AtomicReference<Double>> gaugeValues = new ConcurrentHashMap<>();

    @Inject
    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void emit(Metric metric) {
        String name = MetricNameBuilder.build(metric.namespace(), metric.name());
        Tags tags = toTags(metric.dimensions());
        switch (metric.type()) {
            case COUNTER -> Counter.builder(name)
                    .tags(tags)
                    .baseUnit(metric.unit().baseUnit())
                    .register(registry)
                    .increment(metric.value());
            case GAUGE -> gaugeValue(name, tags, metric.unit()).set(metric.value());
        }
        log.debug("Emitted {} {}={} {}", metric.type(), name, metric.value(), metric.dimensions());
    }

    private AtomicReference<Double> gaugeValue(String name, Tags tags, Metric.Unit unit) {
        return gaugeValues.computeIfAbsent(gaugeKey(name, tags), key -> {
            AtomicReference<Double> value = new AtomicReference<>(0.0);
            Gauge.builder(name, value::get)
                    .tags(tags)
                    .baseUnit(unit.baseUnit())
                    .strongReference(true)
                    .register(registry);
            return value;
        });
    }

    private static Tags toTags(Map<String, String> dimensions) {
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> dimension : dimensions.entrySet()) {
            tags = tags.and(dimension.getKey(), dimension.getValue());
        }
        return tags;
    }

    private static String gaugeKey(String name, Tags tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append('|').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return key.toString();
    }
}
