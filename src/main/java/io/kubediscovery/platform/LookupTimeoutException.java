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

import java.time.Duration;

public class LookupTimeoutException extends KubeApiException {

    public LookupTimeoutException(Duration timeout) {
        this(timeout, null);
    }

    public LookupTimeoutException(Duration timeout, Throwable cause) {
        super(
                Kind.TIMEOUT,
                String.format(
                        "Kubernetes API request did not complete within %d ms",
                        timeout.toMillis()),
                cause);
    }
}
