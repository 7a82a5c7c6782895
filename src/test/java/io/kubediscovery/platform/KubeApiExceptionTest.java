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

import java.io.IOException;
import java.net.UnknownHostException;
import java.time.Duration;

import io.kubediscovery.platform.KubeApiException.Kind;

import org.apache.commons.lang3.StringUtils;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

class KubeApiExceptionTest {

    @Test
    void shouldCarryKind() {
        MatcherAssert.assertThat(
                new ConfigurationMissingException("missing").getKind(),
                Matchers.equalTo(Kind.CONFIGURATION_MISSING));
        MatcherAssert.assertThat(
                new ForbiddenException().getKind(), Matchers.equalTo(Kind.FORBIDDEN));
        MatcherAssert.assertThat(
                new NonSuccessStatusException(500).getKind(),
                Matchers.equalTo(Kind.NON_SUCCESS_STATUS));
        MatcherAssert.assertThat(
                new UnmarshalException("{}", new IOException()).getKind(),
                Matchers.equalTo(Kind.UNMARSHAL_FAILURE));
        MatcherAssert.assertThat(
                new LookupTimeoutException(Duration.ofSeconds(1)).getKind(),
                Matchers.equalTo(Kind.TIMEOUT));
        MatcherAssert.assertThat(
                new NetworkFailureException(new IOException("reset")).getKind(),
                Matchers.equalTo(Kind.NETWORK_FAILURE));
        MatcherAssert.assertThat(
                new AddressResolutionException("x", new UnknownHostException()).getKind(),
                Matchers.equalTo(Kind.ADDRESS_RESOLUTION_FAILURE));
    }

    @Test
    void shouldReportStatusCode() {
        NonSuccessStatusException ex = new NonSuccessStatusException(503);
        MatcherAssert.assertThat(ex.getStatusCode(), Matchers.equalTo(503));
        MatcherAssert.assertThat(
                ex.getMessage(), Matchers.equalTo("Non-200 from Kubernetes API server: 503"));
    }

    @Test
    void shouldReportTimeout() {
        MatcherAssert.assertThat(
                new LookupTimeoutException(Duration.ofMillis(1500)).getMessage(),
                Matchers.containsString("1500 ms"));
    }

    @Test
    void shouldKeepWholeBodyButAbbreviateMessage() {
        String body = StringUtils.repeat('x', 1000);
        IOException cause = new IOException("bad");

        UnmarshalException ex = new UnmarshalException(body, cause);

        MatcherAssert.assertThat(ex.getBody(), Matchers.equalTo(body));
        MatcherAssert.assertThat(ex.getCause(), Matchers.sameInstance(cause));
        MatcherAssert.assertThat(ex.getMessage(), Matchers.not(Matchers.containsString(body)));
        MatcherAssert.assertThat(ex.getMessage(), Matchers.endsWith("..."));
    }

    @Test
    void shouldReportUnresolvableAddress() {
        AddressResolutionException ex =
                new AddressResolutionException("not-an-ip", new UnknownHostException());
        MatcherAssert.assertThat(ex.getAddress(), Matchers.equalTo("not-an-ip"));
        MatcherAssert.assertThat(ex.getMessage(), Matchers.containsString("not-an-ip"));
    }
}
