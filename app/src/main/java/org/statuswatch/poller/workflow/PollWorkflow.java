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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.exception.PollerException;
import org.statuswatch.poller.metrics.FailureReporter;
import org.statuswatch.poller.model.ErrorKind;
import org.statuswatch.poller.poll.Poller;
import org.statuswatch.poller.preprocess.Preprocessor;
import org.statuswatch.poller.store.ConfigStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one execution per trigger event as an explicit state machine.
 *
 * <p><b>Transitions:</b>
 * <ol>
 *   <li>INIT: context seeded with the application name</li>
 *   <li>CONFIG_LOOKUP: config read fresh from the store</li>
 *   <li>POLL: credential resolved and endpoint polled</li>
 *   <li>DECISION: PREPROCESS if the poll is ok, otherwise REPORT_FAILURE</li>
 *   <li>PREPROCESS or REPORT_FAILURE: emit business metrics, then DONE</li>
 * </ol>
 *
 * <p>Faults while looking up config, polling or preprocessing go to the
 * {@link ExecutionFailureSignal} instead of the business metrics. An interrupted
 * execution ends {@link ExecutionOutcome#CANCELLED} and emits nothing.
 */
@Slf4j
@ApplicationScoped
public class PollWorkflow {

    private final ConfigStore configStore;
    private final Poller poller;
    private final Preprocessor preprocessor;
    private final FailureReporter failureReporter;
    private final ExecutionFailureSignal failureSignal;
    private final Clock clock;

    @Inject
    public PollWorkflow(ConfigStore configStore,
                        Poller poller,
                        Preprocessor preprocessor,
                        FailureReporter failureReporter,
                        ExecutionFailureSignal failureSignal) {
        this(configStore, poller, preprocessor, failureReporter, failureSignal, Clock.systemUTC());
    }

    PollWorkflow(ConfigStore configStore,
                 Poller poller,
                 Preprocessor preprocessor,
                 FailureReporter failureReporter,
                 ExecutionFailureSignal failureSignal,
                 Clock clock) {
        this.configStore = configStore;
        this.poller = poller;
        this.preprocessor = preprocessor;
        this.failureReporter = failureReporter;
        this.failureSignal = failureSignal;
        this.clock = clock;
    }

    /**
     * Run one execution to a terminal outcome. Never throws.
     *
     * @param event Trigger event
     * @return Execution result
     */
    public ExecutionResult run(TriggerEvent event) {
        Instant started = clock.instant();
        Execution execution = new Execution(ExecutionContext.start(event.appName()));
        log.debug("Execution started for '{}'", event.appName());

        try {
            while (execution.state != WorkflowState.DONE) {
                WorkflowState next = step(execution);
                log.debug("'{}': {} -> {}", event.appName(), execution.state, next);
                execution.state = next;
            }
            return ExecutionResult.completed(execution.context, execution.outcome, started, elapsedSince(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(execution, started);
        } catch (PollerException e) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(execution, started);
            }
            return failed(execution, e.getKind(), e, started);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(execution, started);
            }
            return failed(execution, ErrorKind.UNEXPECTED, e, started);
        }
    }

    private WorkflowState step(Execution execution) throws InterruptedException {
        ExecutionContext context = execution.context;
        return switch (execution.state) {
            case INIT -> WorkflowState.CONFIG_LOOKUP;
            case CONFIG_LOOKUP -> {
                execution.context = context.withConfig(configStore.resolve(context.appName()));
                yield WorkflowState.POLL;
            }
            case POLL -> {
                execution.context = context.withPoll(poller.poll(context.config()));
                yield WorkflowState.DECISION;
            }
            case DECISION -> context.poll().ok() ? WorkflowState.PREPROCESS : WorkflowState.REPORT_FAILURE;
            case PREPROCESS -> {
                ensureNotCancelled(context);
                preprocessor.process(context);
                execution.outcome = ExecutionOutcome.PREPROCESSED;
                yield WorkflowState.DONE;
            }
            case REPORT_FAILURE -> {
                ensureNotCancelled(context);
                failureReporter.report(context);
                execution.outcome = ExecutionOutcome.FAILURE_REPORTED;
                yield WorkflowState.DONE;
            }
            case DONE -> throw new IllegalStateException("Execution for '" + context.appName() + "' already done");
        };
    }

    private static void ensureNotCancelled(ExecutionContext context) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Execution for '" + context.appName() + "' cancelled");
        }
    }

    private ExecutionResult cancelled(Execution execution, Instant started) {
        log.warn("Execution for '{}' cancelled in state {}", execution.context.appName(), execution.state);
        return ExecutionResult.cancelled(execution.context, execution.state, started, elapsedSince(started));
    }

    private ExecutionResult failed(Execution execution, ErrorKind kind, RuntimeException cause, Instant started) {
        String appName = execution.context.appName();
        if (!kind.isExecutionFault()) {
            log.warn("'{}' raised {} in state {} instead of returning it in the poll result",
                    appName, kind, execution.state);
        }
        failureSignal.raise(appName, kind, cause);
        return ExecutionResult.failed(execution.context, execution.state, kind, cause.getMessage(),
                started, elapsedSince(started));
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }

    private static final class Execution {
        private ExecutionContext context;
        private WorkflowState state = WorkflowState.INIT;
        private ExecutionOutcome outcome;

        private Execution(ExecutionContext context) {
            this.context = context;
        }
    }
}
