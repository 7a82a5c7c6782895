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
package io.kubediscovery.platform;

/**
 * Base type for every way a lookup against the Kubernetes API can fail. Lookups deliver these as
 * the cause of a failed future; {@link #getKind()} lets callers branch without instanceof chains.
 */
public abstract class KubeApiException extends RuntimeException {

    public enum Kind {
        CONFIGURATION_MISSING,
        FORBIDDEN,
        NON_SUCCESS_STATUS,
        UNMARSHAL_FAILURE,
        TIMEOUT,
        NETWORK_FAILURE,
        ADDRESS_RESOLUTION_FAILURE,
    }

    private final Kind kind;

    protected KubeApiException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected KubeApiException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
