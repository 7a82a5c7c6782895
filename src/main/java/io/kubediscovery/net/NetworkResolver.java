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
package io.kubediscovery.net;

import java.net.InetAddress;
import java.net.UnknownHostException;

import io.netty.util.NetUtil;

public class NetworkResolver {

    public NetworkResolver() {}

    /**
     * Converts an IPv4 or IPv6 literal into an {@link InetAddress} without consulting DNS, so it
     * is safe to call from an event loop thread.
     *
     * @throws UnknownHostException if the string is not an IP address literal
     */
    public InetAddress parseLiteral(String ip) throws UnknownHostException {
        InetAddress addr = ip == null ? null : NetUtil.createInetAddressFromIpAddressString(ip);
        if (addr == null) {
            throw new UnknownHostException(
                    String.format("\"%s\" is not an IP address literal", ip));
        }
        return addr;
    }
}
