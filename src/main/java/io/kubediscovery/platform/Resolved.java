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

import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/** Point-in-time result of a lookup. An empty address list is a valid, successful result. */
public final class Resolved {

    private final String serviceName;
    private final List<ResolvedTarget> addresses;

    public Resolved(String serviceName, List<ResolvedTarget> addresses) {
        this.serviceName = Objects.requireNonNull(serviceName);
        this.addresses = List.copyOf(addresses);
    }

    public String getServiceName() {
        return serviceName;
    }

    public List<ResolvedTarget> getAddresses() {
        return addresses;
    }

    @Override
    public boolean equals(Object other) {
        if (other == null) {
            return false;
        }
        if (other == this) {
            return true;
        }
        if (!(other instanceof Resolved)) {
            return false;
        }
        Resolved o = (Resolved) other;
        return new EqualsBuilder()
                .append(serviceName, o.serviceName)
                .append(addresses, o.addresses)
                .build();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(serviceName).append(addresses).toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("serviceName", serviceName)
                .append("addresses", addresses)
                .toString();
    }
}
