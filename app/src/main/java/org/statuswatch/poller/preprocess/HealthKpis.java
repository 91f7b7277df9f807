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

import org.statuswatch.poller.common.Constants;
import org.statuswatch.poller.model.Metric;
import org.statuswatch.poller.model.StatusCategory;

import java.util.List;
import java.util.Map;

/**
 * Aggregate health indicators of one poll.
 *
 * @param total               Number of services
 * @param ok                  Services in {@link StatusCategory#OK}
 * @param outage              Services in {@link StatusCategory#OUTAGE}
 * @param degraded            Services in {@link StatusCategory#DEGRADED}
 * @param recovering          Services in {@link StatusCategory#RECOVERING}
 * @param investigating       Services in {@link StatusCategory#INVESTIGATING}
 * @param availabilityPercent Share of services not in outage, 0..100
 * @param criticalScore       Sum of category weights
 */
public record HealthKpis(int total,
                         int ok,
                         int outage,
                         int degraded,
                         int recovering,
                         int investigating,
                         double availabilityPercent,
                         double criticalScore) {

    public int impactedServices() {
        return outage + degraded + recovering + investigating;
    }

    /**
     * Worst category present, OK when every service is operational.
     */
    public StatusCategory overallCategory() {
        if (outage > 0) {
            return StatusCategory.OUTAGE;
        }
        if (degraded > 0) {
            return StatusCategory.DEGRADED;
        }
        if (investigating > 0) {
            return StatusCategory.INVESTIGATING;
        }
        if (recovering > 0) {
            return StatusCategory.RECOVERING;
        }
        return StatusCategory.OK;
    }

    /**
     * KPI metrics, all dimensioned by application name.
     *
     * @param namespace Target namespace
     * @param appName   Application name
     * @return Metrics in emission order
     */
    public List<Metric> toMetrics(String namespace, String appName) {
        Map<String, String> dimensions = Map.of(Constants.DIMENSION_APP_NAME, appName);
        return List.of(
                Metric.gauge(namespace, Constants.METRIC_AVAILABILITY, availabilityPercent, Metric.Unit.PERCENT, dimensions),
                Metric.gauge(namespace, Constants.METRIC_OUTAGE_COUNT, outage, Metric.Unit.COUNT, dimensions),
                Metric.gauge(namespace, Constants.METRIC_DEGRADED_COUNT, degraded, Metric.Unit.COUNT, dimensions),
                Metric.gauge(namespace, Constants.METRIC_RECOVERING_COUNT, recovering, Metric.Unit.COUNT, dimensions),
                Metric.gauge(namespace, Constants.METRIC_INVESTIGATING_COUNT, investigating, Metric.Unit.COUNT, dimensions),
                Metric.gauge(namespace, Constants.METRIC_CRITICAL_SCORE, criticalScore, Metric.Unit.NONE, dimensions));
    }
}
