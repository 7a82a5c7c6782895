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

import io.vertx.core.Future;

/**
 * Resolves a logical service name to the network targets currently implementing it.
 * Implementations must report every failure through the returned {@link Future} rather than by
 * throwing.
 */
public interface ServiceDiscovery {

    /**
     * @param query the service to resolve, optionally with a port name overriding the default
     * @param resolveTimeout upper bound for the whole round trip
     * @return the resolved targets, or a failure carrying a {@link KubeApiException}
     */
    Future<Resolved> lookup(Lookup query, Duration resolveTimeout);

    default Future<Resolved> lookup(String serviceName, Duration resolveTimeout) {
        return lookup(Lookup.of(serviceName), resolveTimeout);
    }
}
