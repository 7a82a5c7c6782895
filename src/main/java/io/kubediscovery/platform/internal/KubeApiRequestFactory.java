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

import java.util.Optional;

import io.kubediscovery.configuration.DiscoverySettings;
import io.kubediscovery.sys.Environment;

import org.apache.commons.lang3.StringUtils;

class KubeApiRequestFactory {

    private final Environment env;
    private final DiscoverySettings settings;

    KubeApiRequestFactory(Environment env, DiscoverySettings settings) {
        this.env = env;
        this.settings = settings;
    }

    /**
     * Builds a pod list request from the API server host and port the kubelet publishes in the
     * environment. The variables are read on every call.
     *
     * @return empty if either variable is absent or the port is not an integer
     */
    Optional<PodListRequest> create(String token, String namespace, String labelSelector) {
        String host = env.getEnv(settings.getApiServiceHostEnvName());
        String portStr = env.getEnv(settings.getApiServicePortEnvName());
        if (StringUtils.isBlank(host) || StringUtils.isBlank(portStr)) {
            return Optional.empty();
        }
        int port;
        try {
            port = Integer.parseInt(portStr.strip());
        } catch (NumberFormatException nfe) {
            return Optional.empty();
        }
        return Optional.of(new PodListRequest(host, port, namespace, labelSelector, token));
    }

    String missingConfigurationMessage() {
        return String.format(
                "Unable to form request; check Kubernetes environment (expecting env vars %s,"
                        + " %s)",
                settings.getApiServiceHostEnvName(), settings.getApiServicePortEnvName());
    }
}
