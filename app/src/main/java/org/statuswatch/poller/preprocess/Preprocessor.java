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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.config.PreprocessConfig;
import org.statuswatch.poller.exception.PreprocessTargetUnknownException;
import org.statuswatch.poller.metrics.MetricsSink;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.PollResult;
import org.statuswatch.poller.model.ServiceStatus;
import org.statuswatch.poller.workflow.ExecutionContext;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Success branch of an execution: normalizes the poll response with the
 * application's {@link StatusNormalizer}, computes KPIs and emits them.
 *
 * <p>Nothing is emitted unless normalization succeeds, so a response that does
 * not match the vendor schema never produces zero-valued KPIs.
 */
@Slf4j
@ApplicationScoped
public class Preprocessor {

    private final Map<String, StatusNormalizer> normalizers;
    private final MetricsSink metricsSink;
    private final PreprocessConfig preprocessConfig;
    private final Clock clock;

    @Inject
    public Preprocessor(Instance<StatusNormalizer> normalizers,
                        MetricsSink metricsSink,
                        PreprocessConfig preprocessConfig) {
        this(normalizers.stream().toList(), metricsSink, preprocessConfig, Clock.systemUTC());
    }

    Preprocessor(List<StatusNormalizer> normalizers,
                 MetricsSink metricsSink,
                 PreprocessConfig preprocessConfig,
                 Clock clock) {
        this.normalizers = indexByTarget(normalizers);
        this.metricsSink = metricsSink;
        this.preprocessConfig = preprocessConfig;
        this.clock = clock;
    }

    private static Map<String, StatusNormalizer> indexByTarget(List<StatusNormalizer> normalizers) {
        Map<String, StatusNormalizer> byTarget = new HashMap<>();
        for (StatusNormalizer normalizer : normalizers) {
            String target = normalizer.target().toLowerCase(Locale.ROOT);
            StatusNormalizer previous = byTarget.putIfAbsent(target, normalizer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate status normalizer for target '" + target + "': "
                        + previous.getClass().getSimpleName() + " and " + normalizer.getClass().getSimpleName());
            }
            log.info("Registered status normalizer: {}", target);
        }
        return Map.copyOf(byTarget);
    }

    /**
     * Normalize the successful poll held by the context and emit its KPIs.
     *
     * @param context Execution context with config and a successful poll
     * @return Health report of the poll
     * @throws PreprocessTargetUnknownException                         if no normalizer serves the target
     * @throws org.statuswatch.poller.exception.PreprocessParseException if the body does not match the vendor schema
     */
    public HealthReport process(ExecutionContext context) {
        AppConfig config = context.config();
        PollResult poll = context.poll();
        if (config == null || poll == null || !poll.ok()) {
            throw new IllegalStateException("Preprocessing requires a successful poll for '" + context.appName() + "'");
        }

        String target = config.preprocessTarget().toLowerCase(Locale.ROOT);
        StatusNormalizer normalizer = normalizers.get(target);
        if (normalizer == null) {
            throw new PreprocessTargetUnknownException(config.preprocessTarget());
        }

        List<ServiceStatus> services = normalizer.normalize(poll.body());
        HealthKpis kpis = KpiCalculator.compute(services);
        String namespace = preprocessConfig.namespaceFor(target);
        metricsSink.emitAll(kpis.toMetrics(namespace, context.appName()));

        HealthReport report = HealthReport.builder()
                .appName(context.appName())
                .observedAt(clock.instant())
                .provider(normalizer.provider())
                .httpStatus(poll.statusCode())
                .overall(kpis.overallCategory())
                .kpis(kpis)
                .services(services)
                .build();
        log.info("Preprocessed '{}' ({}): {} services, overall {}, availability {}%, critical score {}",
                context.appName(), target, kpis.total(), report.overall(),
                kpis.availabilityPercent(), kpis.criticalScore());
        log.debug("Health report for '{}': {}", context.appName(), report);
        return report;
    }

    public int getNormalizerCount() {
        return normalizers.size();
    }
}
