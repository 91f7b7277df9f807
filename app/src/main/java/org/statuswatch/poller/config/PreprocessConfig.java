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
package org.statuswatch.poller.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Metric namespaces for KPI emission, per preprocess target.
 */
@ConfigMapping(prefix = "app.preprocess")
public interface PreprocessConfig {

    @WithDefault("Observability/SaaS")
    String defaultNamespace();

    /**
     * Namespace overrides keyed by preprocess target, e.g.
     * {@code app.preprocess.namespaces.microsoft365=Observability/Microsoft365}.
     */
    Map<String, String> namespaces();

    default String namespaceFor(String target) {
        String namespace = target == null ? null : namespaces().get(target);
        return namespace != null ? namespace : defaultNamespace();
    }
}
