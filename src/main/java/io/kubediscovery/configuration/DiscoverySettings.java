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
package io.kubediscovery.configuration;

import java.util.Optional;

import io.kubediscovery.sys.Environment;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolver configuration, read once from the process environment. Every value has a default
 * suitable for a pod running with a mounted service account.
 */
public class DiscoverySettings {

    public static final String SERVICE_ACCOUNT_DIR =
            "/var/run/secrets/kubernetes.io/serviceaccount";
    public static final String DEFAULT_API_CA_PATH = SERVICE_ACCOUNT_DIR + "/ca.crt";
    public static final String DEFAULT_API_TOKEN_PATH = SERVICE_ACCOUNT_DIR + "/token";
    public static final String DEFAULT_POD_NAMESPACE_PATH = SERVICE_ACCOUNT_DIR + "/namespace";
    public static final String DEFAULT_POD_DOMAIN = "cluster.local";
    public static final String DEFAULT_POD_LABEL_SELECTOR = "app=%s";
    public static final String DEFAULT_POD_PORT_NAME = "management";

    private final String apiCaPath;
    private final String apiTokenPath;
    private final String apiServiceHostEnvName;
    private final String apiServicePortEnvName;
    private final String podNamespace;
    private final String podNamespacePath;
    private final String podDomain;
    private final String podLabelSelector;
    private final String podPortName;

    @SuppressFBWarnings("DMI_HARDCODED_ABSOLUTE_FILENAME")
    DiscoverySettings(Environment env) {
        this.apiCaPath = env.getEnv(Variables.API_CA_PATH, DEFAULT_API_CA_PATH);
        this.apiTokenPath = env.getEnv(Variables.API_TOKEN_PATH, DEFAULT_API_TOKEN_PATH);
        this.apiServiceHostEnvName =
                env.getEnv(Variables.API_SERVICE_HOST_ENV_NAME, Variables.KUBERNETES_SERVICE_HOST);
        this.apiServicePortEnvName =
                env.getEnv(Variables.API_SERVICE_PORT_ENV_NAME, Variables.KUBERNETES_SERVICE_PORT);
        this.podNamespace = env.getEnv(Variables.POD_NAMESPACE);
        this.podNamespacePath =
                env.getEnv(Variables.POD_NAMESPACE_PATH, DEFAULT_POD_NAMESPACE_PATH);
        this.podDomain = env.getEnv(Variables.POD_DOMAIN, DEFAULT_POD_DOMAIN);
        this.podLabelSelector =
                env.getEnv(Variables.POD_LABEL_SELECTOR, DEFAULT_POD_LABEL_SELECTOR);
        this.podPortName = env.getEnv(Variables.POD_PORT_NAME, DEFAULT_POD_PORT_NAME);
    }

    public String getApiCaPath() {
        return apiCaPath;
    }

    public String getApiTokenPath() {
        return apiTokenPath;
    }

    public String getApiServiceHostEnvName() {
        return apiServiceHostEnvName;
    }

    public String getApiServicePortEnvName() {
        return apiServicePortEnvName;
    }

    /** Namespace configured explicitly, which takes precedence over the service account file. */
    public Optional<String> getPodNamespace() {
        return Optional.ofNullable(podNamespace).filter(StringUtils::isNotBlank);
    }

    public String getPodNamespacePath() {
        return podNamespacePath;
    }

    public String getPodDomain() {
        return podDomain;
    }

    public String getPodPortName() {
        return podPortName;
    }

    /** Label selector template, ex. {@code app=%s}. */
    public String getPodLabelSelectorTemplate() {
        return podLabelSelector;
    }

    /**
     * Formats the configured selector template with the service name, ex. {@code app=%s} and
     * {@code my-service} give {@code app=my-service}.
     */
    public String podLabelSelector(String serviceName) {
        return String.format(podLabelSelector, serviceName);
    }
}
