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

import java.util.Map;
import java.util.Objects;

/**
 * A single metric data point to emit.
 *
 * @param namespace  Metric namespace
 * @param name       Metric name
 * @param value      Value
 * @param unit       Unit
 * @param type       Whether the value accumulates (counter) or replaces the last one (gauge)
 * @param dimensions Dimensions, e.g. {@code {AppName: "x"}}
 */
public record Metric(String namespace,
                     String name,
                     double value,
                     Unit unit,
                     Type type,
                     Map<String, String> dimensions) {

    public enum Unit {
        PERCENT("percent"),
        COUNT("count"),
        NONE(null);

        private final String baseUnit;

        Unit(String baseUnit) {
            this.baseUnit = baseUnit;
        }

        public String baseUnit() {
            return baseUnit;
        }
    }

    public enum Type {
        COUNTER,
        GAUGE
    }

    public Metric {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        unit = unit == null ? Unit.NONE : unit;
        type = type == null ? Type.GAUGE : type;
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
    }

    public static Metric gauge(String namespace, String name, double value, Unit unit, Map<String, String> dimensions) {
        return new Metric(namespace, name, value, unit, Type.GAUGE, dimensions);
    }

    public static Metric counter(String namespace, String name, double value, Map<String, String> dimensions) {
        return new Metric(namespace, name, value, Unit.COUNT, Type.COUNTER, dimensions);
    }
}
