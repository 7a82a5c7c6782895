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
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import io.kubediscovery.MainModule;
import io.kubediscovery.net.NetworkResolver;
import io.kubediscovery.platform.AddressResolutionException;
import io.kubediscovery.platform.ResolvedTarget;
import io.kubediscovery.platform.internal.PodList.Container;
import io.kubediscovery.platform.internal.PodList.ContainerPort;
import io.kubediscovery.platform.internal.PodList.Metadata;
import io.kubediscovery.platform.internal.PodList.Pod;
import io.kubediscovery.platform.internal.PodList.PodSpec;
import io.kubediscovery.platform.internal.PodList.PodStatus;

import com.google.gson.Gson;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PodTargetResolverTest {

    static final String NAMESPACE = "my-ns";
    static final String DOMAIN = "cluster.local";
    static final String PORT_NAME = "management";

    PodTargetResolver resolver;

    @BeforeEach
    void setup() {
        resolver = new PodTargetResolver(new NetworkResolver());
    }

    static Pod pod(String name, String deletionTimestamp, String ip, Container... containers) {
        return new Pod(
                new Metadata(name, deletionTimestamp),
                new PodSpec(Arrays.asList(containers)),
                new PodStatus(ip));
    }

    static Container container(String name, ContainerPort... ports) {
        return new Container(name, Arrays.asList(ports));
    }

    static ContainerPort port(String name, int number) {
        return new ContainerPort(name, number);
    }

    static InetAddress ipv4(int a, int b, int c, int d) throws Exception {
        return InetAddress.getByAddress(new byte[] {(byte) a, (byte) b, (byte) c, (byte) d});
    }

    List<ResolvedTarget> targets(Pod... pods) {
        return resolver.targets(new PodList(Arrays.asList(pods)), PORT_NAME, NAMESPACE, DOMAIN);
    }

    @Nested
    class Targets {

        @Test
        void shouldResolveRunningPodWithMatchingPort() throws Exception {
            List<ResolvedTarget> targets =
                    targets(pod("a", null, "10.0.1.5", container("app", port(PORT_NAME, 8558))));

            MatcherAssert.assertThat(
                    targets,
                    Matchers.contains(
                            new ResolvedTarget(
                                    "10-0-1-5.my-ns.pod.cluster.local",
                                    8558,
                                    ipv4(10, 0, 1, 5))));
        }

        @Test
        void shouldResolveApiServerResponse() throws Exception {
            PodListParser parser = new PodListParser(MainModule.provideGson());
            PodList podList = parser.parse(PodListFixtures.podsJson());

            List<ResolvedTarget> targets = resolver.targets(podList, PORT_NAME, NAMESPACE, DOMAIN);

            MatcherAssert.assertThat(
                    targets,
                    Matchers.contains(
                            new ResolvedTarget(
                                    "10-0-1-5.my-ns.pod.cluster.local",
                                    8558,
                                    ipv4(10, 0, 1, 5))));
        }

        @Test
        void shouldSkipTerminatingPods() {
            List<ResolvedTarget> targets =
                    targets(
                            pod(
                                    "a",
                                    "2026-10-19T08:15:30Z",
                                    "10.0.1.5",
                                    container("app", port(PORT_NAME, 8558))));
            MatcherAssert.assertThat(targets, Matchers.empty());
        }

        @Test
        void shouldSkipPodsWithoutIp() {
            List<ResolvedTarget> targets =
                    targets(pod("a", null, null, container("app", port(PORT_NAME, 8558))));
            MatcherAssert.assertThat(targets, Matchers.empty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " "})
        void shouldSkipPodsWithBlankIp(String ip) {
            List<ResolvedTarget> targets =
                    targets(pod("a", null, ip, container("app", port(PORT_NAME, 8558))));
            MatcherAssert.assertThat(targets, Matchers.empty());
        }

        @Test
        void shouldSkipPodsWithoutStatus() {
            Pod pod =
                    new Pod(
                            new Metadata("a", null),
                            new PodSpec(List.of(container("app", port(PORT_NAME, 8558)))),
                            null);
            MatcherAssert.assertThat(targets(pod), Matchers.empty());
        }

        @Test
        void shouldSkipNonMatchingPortNames() {
            List<ResolvedTarget> targets =
                    targets(
                            pod(
                                    "a",
                                    null,
                                    "10.0.1.5",
                                    container(
                                            "app",
                                            port("http", 8080),
                                            port("Management", 8558))));
            MatcherAssert.assertThat(targets, Matchers.empty());
        }

        @Test
        void shouldSkipUnnamedPorts() {
            List<ResolvedTarget> targets =
                    targets(
                            pod(
                                    "a",
                                    null,
                                    "10.0.1.5",
                                    new Container("app", List.of(new ContainerPort(null, 8558)))));
            MatcherAssert.assertThat(targets, Matchers.empty());
        }

        @Test
        void shouldNotMatchUnnamedPortWithEmptyName() {
            PodList podList =
                    new PodList(
                            List.of(
                                    pod(
                                            "a",
                                            null,
                                            "10.0.1.5",
                                            new Container(
                                                    "app",
                                                    List.of(new ContainerPort(null, 8558))))));
            MatcherAssert.assertThat(
                    resolver.targets(podList, "", NAMESPACE, DOMAIN), Matchers.empty());
        }

        @Test
        void shouldSelectPortByName() {
            PodList podList =
                    new PodList(
                            List.of(
                                    pod(
                                            "a",
                                            null,
                                            "10.0.1.5",
                                            container(
                                                    "app",
                                                    port("http", 8080),
                                                    port("metrics", 9090)))));

            MatcherAssert.assertThat(
                    resolver.targets(podList, "http", NAMESPACE, DOMAIN).stream()
                            .map(t -> t.getPort().orElseThrow())
                            .collect(Collectors.toList()),
                    Matchers.contains(8080));
            MatcherAssert.assertThat(
                    resolver.targets(podList, "metrics", NAMESPACE, DOMAIN).stream()
                            .map(t -> t.getPort().orElseThrow())
                            .collect(Collectors.toList()),
                    Matchers.contains(9090));
            MatcherAssert.assertThat(
                    resolver.targets(podList, "grpc", NAMESPACE, DOMAIN), Matchers.empty());
        }

        @Test
        void shouldResolveEncodedPodList() throws Exception {
            Gson gson = MainModule.provideGson();
            PodList original =
                    new PodList(
                            List.of(
                                    pod(
                                            "a",
                                            null,
                                            "10.0.1.5",
                                            container("app", port(PORT_NAME, 8558)))));

            PodList decoded = new PodListParser(gson).parse(gson.toJson(original));

            MatcherAssert.assertThat(
                    resolver.targets(decoded, PORT_NAME, "ns1", DOMAIN),
                    Matchers.contains(
                            new ResolvedTarget(
                                    "10-0-1-5.ns1.pod.cluster.local",
                                    8558,
                                    ipv4(10, 0, 1, 5))));
        }

        @Test
        void shouldEmitEveryMatchingPortInOrder() throws Exception {
            List<ResolvedTarget> targets =
                    targets(
                            pod(
                                    "a",
                                    null,
                                    "10.0.1.5",
                                    container("app", port(PORT_NAME, 8558)),
                                    container("sidecar", port(PORT_NAME, 9558))),
                            pod("b", null, "10.0.2.7", container("app", port(PORT_NAME, 8558))));

            MatcherAssert.assertThat(
                    targets,
                    Matchers.contains(
                            new ResolvedTarget(
                                    "10-0-1-5.my-ns.pod.cluster.local", 8558, ipv4(10, 0, 1, 5)),
                            new ResolvedTarget(
                                    "10-0-1-5.my-ns.pod.cluster.local", 9558, ipv4(10, 0, 1, 5)),
                            new ResolvedTarget(
                                    "10-0-2-7.my-ns.pod.cluster.local",
                                    8558,
                                    ipv4(10, 0, 2, 7))));
        }

        @Test
        void shouldTolerateMissingStructure() {
            Pod noSpec = new Pod(new Metadata("a", null), null, new PodStatus("10.0.1.5"));
            Pod noContainers =
                    new Pod(new Metadata("b", null), new PodSpec(null), new PodStatus("10.0.1.6"));
            Pod noPorts = pod("c", null, "10.0.1.7", new Container("app", null));
            Pod noMetadata =
                    new Pod(
                            null,
                            new PodSpec(List.of(container("app", port("http", 8080)))),
                            new PodStatus("10.0.1.8"));

            MatcherAssert.assertThat(
                    targets(noSpec, noContainers, noPorts, noMetadata), Matchers.empty());
            MatcherAssert.assertThat(
                    resolver.targets(new PodList(null), PORT_NAME, NAMESPACE, DOMAIN),
                    Matchers.empty());
        }

        @Test
        void shouldResolveIpv6PodAddress() throws Exception {
            List<ResolvedTarget> targets =
                    targets(pod("a", null, "fd00::5", container("app", port(PORT_NAME, 8558))));

            MatcherAssert.assertThat(targets, Matchers.hasSize(1));
            MatcherAssert.assertThat(
                    targets.get(0).getAddress().orElseThrow(),
                    Matchers.equalTo(InetAddress.getByName("fd00::5")));
        }

        @Test
        void shouldFailOnInvalidPodIp() {
            AddressResolutionException ex =
                    Assertions.assertThrows(
                            AddressResolutionException.class,
                            () ->
                                    targets(
                                            pod(
                                                    "a",
                                                    null,
                                                    "not-an-ip",
                                                    container("app", port(PORT_NAME, 8558)))));
            MatcherAssert.assertThat(ex.getAddress(), Matchers.equalTo("not-an-ip"));
        }
    }

    @Nested
    class PortNames {

        @Test
        void shouldListDistinctSortedPortNames() {
            PodList podList =
                    new PodList(
                            List.of(
                                    pod(
                                            "a",
                                            null,
                                            "10.0.1.5",
                                            container(
                                                    "app",
                                                    port("metrics", 9090),
                                                    port("http", 80)),
                                            container("sidecar", port("admin", 9901))),
                                    pod(
                                            "b",
                                            "2026-10-19T08:15:30Z",
                                            null,
                                            container("app", port("http", 80)),
                                            new Container(
                                                    "init",
                                                    List.of(new ContainerPort(null, 1))))));

            MatcherAssert.assertThat(
                    resolver.portNames(podList), Matchers.contains("admin", "http", "metrics"));
        }

        @Test
        void shouldListNothingForEmptyPodList() {
            MatcherAssert.assertThat(
                    resolver.portNames(new PodList(List.of())), Matchers.empty());
        }
    }

    @Test
    void shouldFormatPodHostname() {
        MatcherAssert.assertThat(
                PodTargetResolver.hostname("172.17.0.12", "default", "cluster.local"),
                Matchers.equalTo("172-17-0-12.default.pod.cluster.local"));
        MatcherAssert.assertThat(
                PodTargetResolver.hostname("10.0.1.5", "team-a", "example.internal"),
                Matchers.equalTo("10-0-1-5.team-a.pod.example.internal"));
    }
}
