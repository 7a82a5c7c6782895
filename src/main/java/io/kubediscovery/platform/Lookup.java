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

import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

public final class Lookup {

    private final String serviceName;
    private final String portName;

    private Lookup(String serviceName, String portName) {
        if (StringUtils.isBlank(serviceName)) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        this.serviceName = serviceName;
        this.portName = portName;
    }

    public static Lookup of(String serviceName) {
        return new Lookup(serviceName, null);
    }

    public Lookup withPortName(String portName) {
        return new Lookup(serviceName, Objects.requireNonNull(portName));
    }

    public String getServiceName() {
        return serviceName;
    }

    /** Port name overriding the configured default, if the caller asked for one. */
    public Optional<String> getPortName() {
        return Optional.ofNullable(portName);
    }

    @Override
    public boolean equals(Object other) {
        if (other == null) {
            return false;
        }
        if (other == this) {
            return true;
        }
        if (!(other instanceof Lookup)) {
            return false;
        }
        Lookup o = (Lookup) other;
        return new EqualsBuilder()
                .append(serviceName, o.serviceName)
                .append(portName, o.portName)
                .build();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(serviceName).append(portName).toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("serviceName", serviceName)
                .append("portName", portName)
                .toString();
    }
}
