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

import java.util.List;

/**
 * The subset of the Kubernetes {@code PodList} resource needed for resolution. Field names match
 * the API's JSON so that Gson can bind them directly; anything else in the response is ignored.
 */
record PodList(List<Pod> items) {

    record Pod(Metadata metadata, PodSpec spec, PodStatus status) {}

    record Metadata(String name, String deletionTimestamp) {}

    record PodSpec(List<Container> containers) {}

    record Container(String name, List<ContainerPort> ports) {}

    record ContainerPort(String name, Integer containerPort) {}

    record PodStatus(String podIP) {}
}
