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
import org.statuswatch.poller.config.StoreConfig;
import org.statuswatch.poller.exception.ConfigFormatException;
import org.statuswatch.poller.exception.ConfigNotFoundException;
import org.statuswatch.poller.model.AppConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Config store backed by a directory of {@code <appName>.json} items.
 *
 * <p>Every call reads the file again, so there is no stale-read window.
 */
@Slf4j
@ApplicationScoped
public class FileConfigStore implements ConfigStore {

    private static final String ITEM_SUFFIX = ".json";

    private final Path configDir;
    private final ConfigItemParser parser;

    @Inject
    public FileConfigStore(StoreConfig storeConfig, ConfigItemParser parser) {
        this(storeConfig.configDir(), parser);
    }

    FileConfigStore(Path configDir, ConfigItemParser parser) {
        this.configDir = configDir;
        this.parser = parser;
    }

    @Override
    public AppConfig resolve(String appName) {
        if (!isValidAppName(appName)) {
            log.warn("Rejected invalid application name: '{}'", appName);
            throw new ConfigNotFoundException(appName);
        }

        Path item = configDir.resolve(appName + ITEM_SUFFIX);
        if (!Files.isRegularFile(item)) {
            throw new ConfigNotFoundException(appName);
        }

        String content;
        try {
            content = Files.readString(item, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigFormatException("Unable to read config item " + item + ": " + e.getMessage(), e);
        }
        log.debug("Loaded config item for '{}' from {}", appName, item);
        return parser.parse(appName, content);
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(configDir) && Files.isReadable(configDir);
    }

    /**
     * Validate the application name before it becomes part of a path.
     */
    private boolean isValidAppName(String appName) {
        if (appName == null || appName.isBlank()) {
            return false;
        }
        return !appName.contains("/") && !appName.contains("\\") && !appName.contains("..");
    }
}
