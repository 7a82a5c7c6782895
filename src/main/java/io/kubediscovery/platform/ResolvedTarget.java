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

import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

public final class ResolvedTarget {

    private final String host;
    private final Integer port;
    private final InetAddress address;

    public ResolvedTarget(String host, Integer port, InetAddress address) {
        this.host = Objects.requireNonNull(host);
        this.port = port;
        this.address = address;
    }

    /** Per-pod DNS name, ex. {@code 10-0-1-5.my-namespace.pod.cluster.local}. */
    public String getHost() {
        return host;
    }

    public Optional<Integer> getPort() {
        return Optional.ofNullable(port);
    }

    public Optional<InetAddress> getAddress() {
        return Optional.ofNullable(address);
    }

    @Override
    public boolean equals(Object other) {
        if (other == null) {
            return false;
        }
        if (other == this) {
            return true;
        }
        if (!(other instanceof ResolvedTarget)) {
            return false;
        }
        ResolvedTarget o = (ResolvedTarget) other;
        return new EqualsBuilder()
                .append(host, o.host)
                .append(port, o.port)
                .append(address, o.address)
                .build();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(host).append(port).append(address).toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("host", host)
                .append("port", port)
                .append("address", address)
                .toString();
    }
}
