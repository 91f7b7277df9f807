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

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.model.ServiceStatus;

import java.util.List;

/**
 * Computes {@link HealthKpis} from normalized service statuses.
 *
 * <p>{@code availability = 100 * (total - outage) / total}, rounded to two decimals,
 * and 100 when there are no services.
 * {@code criticalScore = 4*outage + 2*degraded + 1*investigating + 0.5*recovering}.
 */
@Slf4j
@UtilityClass
public class KpiCalculator {

    public static HealthKpis compute(List<ServiceStatus> services) {
        int ok = 0;
        int outage = 0;
        int degraded = 0;
        int recovering = 0;
        int investigating = 0;
        double criticalScore = 0.0;

        for (ServiceStatus service : services) {
            switch (service.category()) {
                case OK -> ok++;
                case OUTAGE -> outage++;
                case DEGRADED -> degraded++;
                case RECOVERING -> recovering++;
                case INVESTIGATING -> investigating++;
            }
            criticalScore += service.category().weight();
        }

        int total = services.size();
        double availability;
        if (total == 0) {
            log.warn("No services in response, reporting availability as 100%");
            availability = 100.0;
        } else {
            availability = Math.round(10000.0 * (total - outage) / total) / 100.0;
        }
        return new HealthKpis(total, ok, outage, degraded, recovering, investigating, availability, criticalScore);
    }
}
