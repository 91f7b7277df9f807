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
package org.statuswatch.poller.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for poller metrics and dimensions
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE_POLLER = "Observability/Poller";
    public static final String DIMENSION_APP_NAME = "AppName";
    public static final String DIMENSION_ERROR_KIND = "ErrorKind";
    public static final String DIMENSION_OUTCOME = "Outcome";

    public static final String METRIC_POLL_FAILED = "PollFailed";
    public static final String METRIC_EXECUTION_FAILED = "ExecutionFailed";
    public static final String METRIC_EXECUTIONS_TOTAL = "ExecutionsTotal";
    public static final String METRIC_EXECUTION_DURATION = "ExecutionDuration";

    public static final String METRIC_AVAILABILITY = "OverallAvailabilityPercent";
    public static final String METRIC_OUTAGE_COUNT = "ServicesOutageCount";
    public static final String METRIC_DEGRADED_COUNT = "ServicesDegradedCount";
    public static final String METRIC_RECOVERING_COUNT = "ServicesRecoveringCount";
    public static final String METRIC_INVESTIGATING_COUNT = "ServicesInvestigatingCount";
    public static final String METRIC_CRITICAL_SCORE = "CriticalScore";

    public static final String AUTH_SOURCE_SECRET_PREFIX = "secret:";
    public static final String AUTH_SOURCE_FALLBACK = "fallback";
    public static final String REDACTED = "***";
}
