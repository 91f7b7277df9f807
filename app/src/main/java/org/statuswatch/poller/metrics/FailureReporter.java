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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.common.Constants;
import org.statuswatch.poller.model.Metric;
import org.statuswatch.poller.model.PollResult;
import org.statuswatch.poller.workflow.ExecutionContext;

import java.util.Map;

/**
 * Failure branch of an execution: emits {@code PollFailed = 1} for the application.
 */
@Slf4j
@ApplicationScoped
public class FailureReporter {

    private final MetricsSink metricsSink;

    @Inject
    public FailureReporter(MetricsSink metricsSink) {
        this.metricsSink = metricsSink;
    }

    public void report(ExecutionContext context) {
        PollResult poll = context.poll();
        log.warn("Poll failed for '{}': kind={}, status={}, attempts={}",
                context.appName(),
                poll == null ? null : poll.errorKind(),
                poll == null ? null : poll.statusCode(),
                poll == null ? 0 : poll.attemptCount());
        metricsSink.emit(Metric.counter(Constants.NAMESPACE_POLLER, Constants.METRIC_POLL_FAILED, 1,
                Map.of(Constants.DIMENSION_APP_NAME, context.appName())));
    }
}
