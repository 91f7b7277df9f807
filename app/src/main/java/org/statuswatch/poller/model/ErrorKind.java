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
package org.statuswatch.poller.model;

/**
 * Failure taxonomy shared by every stage of an execution.
 *
 * <p>Execution-level faults mean the monitor itself is broken (missing config,
 * unreadable secret store, malformed vendor payload) and are surfaced through
 * the execution-failure signal. All other kinds describe a failure of the
 * monitored platform and end in the {@code PollFailed} branch.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND(true),
    CONFIG_FORMAT_ERROR(true),
    SECRET_NOT_FOUND(false),
    SECRET_FIELD_MISSING(false),
    SECRET_FORMAT_ERROR(false),
    SECRET_STORE_UNAVAILABLE(true),
    TRANSIENT_HTTP_ERROR(false),
    PERMANENT_HTTP_ERROR(false),
    TIMEOUT(false),
    CONNECTION_ERROR(false),
    INVALID_REQUEST(false),
    PREPROCESS_PARSE_ERROR(true),
    PREPROCESS_TARGET_UNKNOWN(true),
    UNEXPECTED(true);

    private final boolean executionFault;

    ErrorKind(boolean executionFault) {
        this.executionFault = executionFault;
    }

    public boolean isExecutionFault() {
        return executionFault;
    }
}
