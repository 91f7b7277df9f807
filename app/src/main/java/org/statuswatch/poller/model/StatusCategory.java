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
 * Normalized service status categories.
 *
 * <p>The weight is the per-service contribution to the critical score.
 * Rank orders categories by operational severity when deriving an overall status.
 */
public enum StatusCategory {
    OK(0.0, 0),
    RECOVERING(0.5, 1),
    INVESTIGATING(1.0, 2),
    DEGRADED(2.0, 3),
    OUTAGE(4.0, 4);

    private final double weight;
    private final int rank;

    StatusCategory(double weight, int rank) {
        this.weight = weight;
        this.rank = rank;
    }

    public double weight() {
        return weight;
    }

    public int rank() {
        return rank;
    }
}
