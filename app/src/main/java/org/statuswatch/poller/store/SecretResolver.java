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
package org.statuswatch.poller.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.statuswatch.poller.exception.SecretResolutionException;
import org.statuswatch.poller.model.SecretRef;

import java.util.Objects;

/**
 * Resolves a {@link SecretRef} into a credential.
 *
 * <p>Without a JSON key the stored value is returned verbatim. With a JSON key
 * the stored value must be a JSON object containing that key.
 * Nothing is cached between calls.
 */
@Slf4j
@ApplicationScoped
public class SecretResolver {

    private final SecretStore secretStore;
    private final ObjectMapper objectMapper;

    @Inject
    public SecretResolver(SecretStore secretStore, ObjectMapper objectMapper) {
        this.secretStore = Objects.requireNonNull(secretStore, "secretStore");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Resolve a credential.
     *
     * @param secretRef Secret reference (never null)
     * @return Credential value
     * @throws SecretResolutionException if the secret is missing, malformed or lacks the requested field
     */
    public String resolve(SecretRef secretRef) {
        Objects.requireNonNull(secretRef, "secretRef");
        log.debug("Resolving secret '{}' (json key: {})", secretRef.name(), secretRef.hasJsonKey());

        String raw = secretStore.read(secretRef.name());
        if (!secretRef.hasJsonKey()) {
            return raw;
        }

        JsonNode document;
        try {
            document = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw SecretResolutionException.formatError(secretRef.name(), "invalid JSON", e);
        }
        if (document == null || !document.isObject()) {
            throw SecretResolutionException.formatError(secretRef.name(), "not an object", null);
        }

        JsonNode field = document.get(secretRef.jsonKey());
        if (field == null || field.isNull()) {
            throw SecretResolutionException.fieldMissing(secretRef.name(), secretRef.jsonKey());
        }
        return field.isValueNode() ? field.asText() : field.toString();
    }
}
