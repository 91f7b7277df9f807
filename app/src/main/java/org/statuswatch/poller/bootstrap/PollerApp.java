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
package org.statuswatch.poller.bootstrap;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.config.PollerConfig;
import org.statuswatch.poller.config.ScheduleConfig;
import org.statuswatch.poller.config.StoreConfig;
import org.statuswatch.poller.preprocess.Preprocessor;
import org.statuswatch.poller.workflow.ExecutionService;

import java.util.List;

/**
 * Application lifecycle bean: logs the configuration on startup and triggers
 * one execution per configured application on every scheduler tick.
 */
@Slf4j
@ApplicationScoped
public class PollerApp {

    private final ExecutionService executionService;
    private final ScheduleConfig scheduleConfig;
    private final StoreConfig storeConfig;
    private final PollerConfig pollerConfig;
    private final Preprocessor preprocessor;
    private final Banners banner;

    @Inject
    public PollerApp(ExecutionService executionService,
                     ScheduleConfig scheduleConfig,
                     StoreConfig storeConfig,
                     PollerConfig pollerConfig,
                     Preprocessor preprocessor,
                     Banners banner) {
        this.executionService = executionService;
        this.scheduleConfig = scheduleConfig;
        this.storeConfig = storeConfig;
        this.pollerConfig = pollerConfig;
        this.preprocessor = preprocessor;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        if (scheduledApps().isEmpty()) {
            log.warn("No applications configured in app.schedule.apps, nothing will be polled");
        }
        banner.printFooter();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Schedule interval:      {}", scheduleConfig.interval());
        log.info("  Applications:           {}", scheduledApps());
        log.info("  Max concurrent runs:    {}", scheduleConfig.maxConcurrentExecutions());
        log.info("  Execution timeout:      {}", scheduleConfig.executionTimeout());
        log.info("  Config directory:       {}", storeConfig.configDir());
        log.info("  Secret directory:       {}", storeConfig.secretDir());
        log.info("  Backoff strategy:       {}", pollerConfig.backoffStrategy());
        log.info("  Debug attempts:         {}", pollerConfig.debug());
        log.info("  Fallback API key:       {}", pollerConfig.fallbackApiKey().isPresent() ? "configured" : "not configured");
        log.info("  Status normalizers:     {}", preprocessor.getNormalizerCount());
    }

    private List<String> scheduledApps() {
        return scheduleConfig.apps().orElse(List.of());
    }

    /**
     * Periodic trigger. Executions run on the execution pool, so a slow
     * execution never delays the next tick.
     */
    @Scheduled(every = "${app.schedule.interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.PROCEED)
    void trigger() {
        List<String> apps = scheduledApps();
        log.debug("Scheduled trigger for {} application(s)", apps.size());
        executionService.submitAll(apps);
    }
}
