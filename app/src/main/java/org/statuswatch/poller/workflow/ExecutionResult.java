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

import org.statuswatch.poller.model.ErrorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one execution.
 *
 * @param appName    Application name
 * @param outcome    Terminal outcome
 * @param finalState State the execution ended in; for faults and cancellation the state that was running
 * @param context    Context accumulated up to the end
 * @param errorKind  Fault kind for {@link ExecutionOutcome#EXECUTION_FAILED}, otherwise null
 * @param error      Fault message, otherwise null
 * @param started    Start of the execution
 * @param duration   Duration of the execution
 */
public record ExecutionResult(String appName,
                              ExecutionOutcome outcome,
                              WorkflowState finalState,
                              ExecutionContext context,
                              ErrorKind errorKind,
                              String error,
                              Instant started,
                              Duration duration) {

    public static ExecutionResult completed(ExecutionContext context,
                                            ExecutionOutcome outcome,
                                            Instant started,
                                            Duration duration) {
        return new ExecutionResult(context.appName(), outcome, WorkflowState.DONE, context,
                null, null, started, duration);
    }

    public static ExecutionResult failed(ExecutionContext context,
                                         WorkflowState state,
                                         ErrorKind errorKind,
                                         String error,
                                         Instant started,
                                         Duration duration) {
        return new ExecutionResult(context.appName(), ExecutionOutcome.EXECUTION_FAILED, state, context,
                errorKind, error, started, duration);
    }

    public static ExecutionResult cancelled(ExecutionContext context,
                                            WorkflowState state,
                                            Instant started,
                                            Duration duration) {
        return new ExecutionResult(context.appName(), ExecutionOutcome.CANCELLED, state, context,
                null, null, started, duration);
    }

    public boolean isFailed() {
        return outcome == ExecutionOutcome.EXECUTION_FAILED;
    }
}
