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

public final class Variables {
    private Variables() {}

    // Kubernetes API server connection
    public static final String API_CA_PATH = "KUBE_DISCOVERY_API_CA_PATH";
    public static final String API_TOKEN_PATH = "KUBE_DISCOVERY_API_TOKEN_PATH";
    public static final String API_SERVICE_HOST_ENV_NAME =
            "KUBE_DISCOVERY_API_SERVICE_HOST_ENV_NAME";
    public static final String API_SERVICE_PORT_ENV_NAME =
            "KUBE_DISCOVERY_API_SERVICE_PORT_ENV_NAME";

    // pod selection
    public static final String POD_NAMESPACE = "KUBE_DISCOVERY_POD_NAMESPACE";
    public static final String POD_NAMESPACE_PATH = "KUBE_DISCOVERY_POD_NAMESPACE_PATH";
    public static final String POD_DOMAIN = "KUBE_DISCOVERY_POD_DOMAIN";
    public static final String POD_LABEL_SELECTOR = "KUBE_DISCOVERY_POD_LABEL_SELECTOR";
    public static final String POD_PORT_NAME = "KUBE_DISCOVERY_POD_PORT_NAME";

    // command line
    public static final String RESOLVE_TIMEOUT_MS = "KUBE_DISCOVERY_RESOLVE_TIMEOUT_MS";

    // set by the kubelet in every pod
    public static final String KUBERNETES_SERVICE_HOST = "KUBERNETES_SERVICE_HOST";
    public static final String KUBERNETES_SERVICE_PORT = "KUBERNETES_SERVICE_PORT";
}
