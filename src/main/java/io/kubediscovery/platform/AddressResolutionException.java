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

public class AddressResolutionException extends KubeApiException {

    private final String address;

    public AddressResolutionException(String address, Throwable cause) {
        super(
                Kind.ADDRESS_RESOLUTION_FAILURE,
                String.format("Unable to resolve pod IP \"%s\"", address),
                cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
