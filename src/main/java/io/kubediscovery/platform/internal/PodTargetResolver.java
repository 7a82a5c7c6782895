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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import io.kubediscovery.net.NetworkResolver;
import io.kubediscovery.platform.AddressResolutionException;
import io.kubediscovery.platform.ResolvedTarget;
import io.kubediscovery.platform.internal.PodList.Container;
import io.kubediscovery.platform.internal.PodList.ContainerPort;
import io.kubediscovery.platform.internal.PodList.Pod;

import org.apache.commons.lang3.StringUtils;

class PodTargetResolver {

    private final NetworkResolver resolver;

    PodTargetResolver(NetworkResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Finds the targets in a pod list. This does not filter by service name, the label selector
     * already did that on the server side.
     *
     * <p>Terminating pods (those with a deletion timestamp) are skipped. Every container port
     * named {@code portName} on a pod with a known IP yields one target, addressed by the pod's
     * DNS name, ex. {@code 10-0-1-5.my-namespace.pod.cluster.local}.
     *
     * @throws AddressResolutionException if a pod IP is not an IP address literal
     */
    List<ResolvedTarget> targets(
            PodList podList, String portName, String podNamespace, String podDomain)
            throws AddressResolutionException {
        List<ResolvedTarget> targets = new ArrayList<>();
        for (Pod pod : pods(podList)) {
            if (isTerminating(pod)) {
                continue;
            }
            String ip = pod.status() == null ? null : pod.status().podIP();
            for (Container container : containers(pod)) {
                for (ContainerPort port : ports(container)) {
                    if (port.name() == null
                            || !port.name().equals(portName)
                            || StringUtils.isBlank(ip)) {
                        continue;
                    }
                    targets.add(
                            new ResolvedTarget(
                                    hostname(ip, podNamespace, podDomain),
                                    port.containerPort(),
                                    address(ip)));
                }
            }
        }
        return targets;
    }

    /** Every named container port across the pod list, for diagnosing port name mismatches. */
    SortedSet<String> portNames(PodList podList) {
        SortedSet<String> names = new TreeSet<>();
        pods(podList).stream()
                .flatMap(pod -> containers(pod).stream())
                .flatMap(container -> ports(container).stream())
                .map(ContainerPort::name)
                .filter(Objects::nonNull)
                .forEach(names::add);
        return names;
    }

    static String hostname(String ip, String podNamespace, String podDomain) {
        return String.format("%s.%s.pod.%s", ip.replace('.', '-'), podNamespace, podDomain);
    }

    private InetAddress address(String ip) throws AddressResolutionException {
        try {
            return resolver.parseLiteral(ip);
        } catch (UnknownHostException e) {
            throw new AddressResolutionException(ip, e);
        }
    }

    private static boolean isTerminating(Pod pod) {
        return pod.metadata() != null
                && StringUtils.isNotEmpty(pod.metadata().deletionTimestamp());
    }

    private static List<Pod> pods(PodList podList) {
        return nonNull(podList.items());
    }

    private static List<Container> containers(Pod pod) {
        return pod.spec() == null ? Collections.emptyList() : nonNull(pod.spec().containers());
    }

    private static List<ContainerPort> ports(Container container) {
        return nonNull(container.ports());
    }

    private static <T> List<T> nonNull(List<T> list) {
        if (list == null) {
            return Collections.emptyList();
        }
        return list.stream().filter(Objects::nonNull).toList();
    }
}
