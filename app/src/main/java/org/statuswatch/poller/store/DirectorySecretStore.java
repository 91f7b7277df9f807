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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.statuswatch.poller.config.StoreConfig;
import org.statuswatch.poller.exception.SecretResolutionException;
import org.statuswatch.poller.exception.SecretStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;

/**
 * Secret store backed by a directory with one file per secret (mounted-secret layout).
 *
 * <p>Secrets are read on every call so that a rotated credential is used
 * by the next poll without a restart.
 */
@Slf4j
@ApplicationScoped
public class DirectorySecretStore implements SecretStore {

    private final Path secretDir;

    @Inject
    public DirectorySecretStore(StoreConfig storeConfig) {
        this(storeConfig.secretDir());
    }

    DirectorySecretStore(Path secretDir) {
        this.secretDir = secretDir;
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, delayUnit = ChronoUnit.MILLIS,
            retryOn = SecretStoreException.class, abortOn = SecretResolutionException.class)
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public String read(String secretName) {
        if (secretName == null || secretName.isBlank()
                || secretName.contains("/") || secretName.contains("\\") || secretName.contains("..")) {
            throw SecretResolutionException.notFound(String.valueOf(secretName));
        }

        Path file = secretDir.resolve(secretName);
        if (!Files.isRegularFile(file)) {
            throw SecretResolutionException.notFound(secretName);
        }
        try {
            log.debug("Reading secret '{}'", secretName);
            return stripTrailingNewline(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read secret '{}' (attempt may be retried): {}", secretName, e.getMessage());
            throw new SecretStoreException("Unable to read secret '" + secretName + "'", e);
        }
    }

    private static String stripTrailingNewline(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == '\n' || value.charAt(end - 1) == '\r')) {
            end--;
        }
        return value.substring(0, end);
    }
}
