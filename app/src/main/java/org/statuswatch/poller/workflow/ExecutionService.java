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
package org.statuswatch.poller.workflow;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.config.ScheduleConfig;
import org.statuswatch.poller.metrics.PollerMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs executions concurrently on a bounded pool.
 *
 * <p>Executions share no state: two triggers for the same application run
 * independently. Scheduled triggers are coalesced while waiting for a worker:
 * an application with a trigger still queued is skipped, so the queue never
 * holds more than one pending execution per application.
 *
 * <p>Each execution is interrupted by a watchdog when it exceeds
 * {@code app.schedule.execution-timeout}, which ends it as cancelled.
 */
@Slf4j
@ApplicationScoped
public class ExecutionService {

    private final PollWorkflow workflow;
    private final PollerMetrics pollerMetrics;
    private final Duration executionTimeout;
    private final ExecutorService executions;
    private final ScheduledExecutorService watchdog;
    private final Set<String> queued = ConcurrentHashMap.newKeySet();

    @Inject
    public ExecutionService(PollWorkflow workflow, PollerMetrics pollerMetrics, ScheduleConfig scheduleConfig) {
        this.workflow = workflow;
        this.pollerMetrics = pollerMetrics;
        this.executionTimeout = scheduleConfig.executionTimeout();
        this.executions = Executors.newFixedThreadPool(scheduleConfig.maxConcurrentExecutions(),
                new NamedThreadFactory("poll-execution-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("poll-watchdog-"));
    }

    /**
     * Start an execution.
     *
     * @param event Trigger event
     * @return Future completing with the execution result
     */
    public Future<ExecutionResult> submit(TriggerEvent event) {
        return executions.submit(() -> execute(event));
    }

    /**
     * Start one execution per application name. Blank names are skipped with a warning,
     * as are applications whose previous trigger has not started yet.
     *
     * @param appNames Application names
     * @return Futures of the queued executions
     */
    public List<Future<ExecutionResult>> submitAll(Collection<String> appNames) {
        List<Future<ExecutionResult>> futures = new ArrayList<>(appNames.size());
        for (String appName : appNames) {
            if (appName == null || appName.isBlank()) {
                log.warn("Skipping trigger with blank application name");
                continue;
            }
            TriggerEvent event = new TriggerEvent(appName);
            if (!queued.add(event.appName())) {
                log.warn("Skipping trigger for '{}': previous trigger is still waiting for a worker",
                        event.appName());
                continue;
            }
            try {
                futures.add(executions.submit(() -> {
                    queued.remove(event.appName());
                    return execute(event);
                }));
            } catch (RejectedExecutionException e) {
                queued.remove(event.appName());
                throw e;
            }
        }
        return futures;
    }

    ExecutionResult execute(TriggerEvent event) {
        WorkerGuard guard = new WorkerGuard(Thread.currentThread());
        ScheduledFuture<?> deadline = watchdog.schedule(() -> {
            if (guard.interrupt()) {
                log.warn("Execution for '{}' exceeded {}, cancelling", event.appName(), executionTimeout);
            }
        }, executionTimeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            ExecutionResult result = workflow.run(event);
            pollerMetrics.recordExecution(result);
            log.info("Execution for '{}' finished: {} in {} ms",
                    event.appName(), result.outcome(), result.duration().toMillis());
            return result;
        } finally {
            guard.release();
            deadline.cancel(false);
            // Clear an interrupt delivered while the run was ending, the thread goes back to the pool
            if (Thread.interrupted()) {
                log.debug("Cleared late cancellation of '{}'", event.appName());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down execution pool");
        executions.shutdownNow();
        watchdog.shutdownNow();
    }

    int queuedCount() {
        return queued.size();
    }

    /**
     * Interrupts a worker only while its execution is running. Once released, a
     * watchdog firing late cannot reach the next task on the same pool thread.
     */
    static final class WorkerGuard {
        private final Thread worker;
        private boolean running = true;

        WorkerGuard(Thread worker) {
            this.worker = worker;
        }

        synchronized boolean interrupt() {
            if (!running) {
                return false;
            }
            worker.interrupt();
            return true;
        }

        synchronized void release() {
            running = false;
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
