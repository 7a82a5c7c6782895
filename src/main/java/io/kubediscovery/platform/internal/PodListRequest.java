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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Everything needed to issue one pod list request against the API server over HTTPS. */
record PodListRequest(
        String host, int port, String namespace, String labelSelector, String token) {

    static final String SCHEME = "https";
    static final String LABEL_SELECTOR_PARAM = "labelSelector";

    String path() {
        return String.format("/api/v1/namespaces/%s/pods", namespace);
    }

    String authorizationHeader() {
        return "Bearer " + token;
    }

    /** Request URI for logging. Excludes the token. */
    URI toUri() {
        return URI.create(
                String.format(
                        "%s://%s:%d%s?%s=%s",
                        SCHEME,
                        host.contains(":") ? "[" + host + "]" : host,
                        port,
                        path(),
                        LABEL_SELECTOR_PARAM,
                        URLEncoder.encode(labelSelector, StandardCharsets.UTF_8)));
    }

    @Override
    public String toString() {
        return String.format("GET %s", toUri());
    }
}
