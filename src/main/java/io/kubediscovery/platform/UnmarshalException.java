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

import org.apache.commons.lang3.StringUtils;

public class UnmarshalException extends KubeApiException {

    static final int MAX_EXCERPT_LENGTH = 256;

    private final String body;

    public UnmarshalException(String body, Throwable cause) {
        super(
                Kind.UNMARSHAL_FAILURE,
                String.format(
                        "Unable to read pod list from Kubernetes API response: %s",
                        StringUtils.abbreviate(body, MAX_EXCERPT_LENGTH)),
                cause);
        this.body = body;
    }

    /** The complete response body that failed to parse. */
    public String getBody() {
        return body;
    }
}
