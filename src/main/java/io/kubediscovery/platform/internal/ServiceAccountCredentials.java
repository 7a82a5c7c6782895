/*
 * Copyright The Cryostat Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.kubediscovery.platform.internal;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import io.kubediscovery.configuration.DiscoverySettings;
import io.kubediscovery.sys.FileSystem;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bearer token and namespace used for every API request. Both are read once, at construction,
 * from the mounted service account files; this is the only blocking IO the resolver performs.
 */
class ServiceAccountCredentials {

    static final String DEFAULT_NAMESPACE = "default";

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final FileSystem fs;
    private final String apiToken;
    private final String podNamespace;

    ServiceAccountCredentials(DiscoverySettings settings, FileSystem fs) {
        this.fs = fs;
        this.apiToken = readValue(fs.pathOf(settings.getApiTokenPath()), "api-token").orElse("");
        this.podNamespace =
                settings.getPodNamespace()
                        .or(
                                () ->
                                        readValue(
                                                fs.pathOf(settings.getPodNamespacePath()),
                                                "pod-namespace"))
                        .orElse(DEFAULT_NAMESPACE);
        logger.info("Using pod namespace \"{}\"", podNamespace);
    }

    String getApiToken() {
        return apiToken;
    }

    String getPodNamespace() {
        return podNamespace;
    }

    /**
     * Reads a configuration value from a file. Missing or unreadable files are reported and
     * yield an empty result, so callers always fall back to a default. Blocking.
     */
    Optional<String> readValue(Path path, String name) {
        try {
            if (!fs.exists(path)) {
                logger.warn("Unable to read {} from {} because it doesn't exist.", name, path);
                return Optional.empty();
            }
            return Optional.of(StringUtils.strip(fs.readString(path)))
                    .filter(StringUtils::isNotEmpty);
        } catch (IOException | SecurityException e) {
            logger.error(String.format("Error reading %s from %s", name, path), e);
            return Optional.empty();
        }
    }
}
