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
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.common.Constants;
import org.statuswatch.poller.common.MetricNameBuilder;
import org.statuswatch.poller.model.ErrorKind;
import org.statuswatch.poller.workflow.ExecutionFailureSignal;
import org.statuswatch.poller.workflow.ExecutionResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Internal poller metrics and the execution-failure signal.
 */
@Slf4j
@ApplicationScoped
public class PollerMetrics implements ExecutionFailureSignal {

    private static final String NAME_EXECUTION_FAILED = MetricNameBuilder.build(Constants.METRIC_EXECUTION_FAILED);
    private static final String NAME_EXECUTIONS_TOTAL = MetricNameBuilder.build(Constants.METRIC_EXECUTIONS_TOTAL);
    private static final String NAME_EXECUTION_DURATION = MetricNameBuilder.build(Constants.METRIC_EXECUTION_DURATION);
    private static final String NAME_UPTIME = MetricNameBuilder.build("UptimeSeconds");

    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    @Inject
    public PollerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the poller started")
                .register(registry);
        log.info("Poller metrics initialized");
    }

    /**
     * Count an execution-level fault, kept apart from {@code PollFailed} so that
     * broken configuration is distinguishable from an unhealthy endpoint.
     */
    @Override
    public void raise(String appName, ErrorKind kind, Throwable cause) {
        log.error("Execution failed for '{}' ({}): {}", appName, kind, cause.getMessage(), cause);
        Counter.builder(NAME_EXECUTION_FAILED)
                .tag(Constants.DIMENSION_APP_NAME, appName)
                .tag(Constants.DIMENSION_ERROR_KIND, kind.name())
                .description("Executions that failed before reaching a business outcome")
                .register(registry)
                .increment();
    }

    public void recordExecution(ExecutionResult result) {
        Counter.builder(NAME_EXECUTIONS_TOTAL)
                .tag(Constants.DIMENSION_OUTCOME, result.outcome().name())
                .description("Executions by terminal outcome")
                .register(registry)
                .increment();
        Timer.builder(NAME_EXECUTION_DURATION)
                .description("Duration of complete executions")
                .register(registry)
                .record(result.duration());
    }
}
