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
package io.kubediscovery;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.time.Duration;
import java.util.logging.LogManager;

import javax.inject.Named;
import javax.inject.Singleton;

import io.kubediscovery.configuration.Variables;
import io.kubediscovery.platform.Lookup;
import io.kubediscovery.platform.Resolved;
import io.kubediscovery.platform.ResolvedTarget;
import io.kubediscovery.platform.ServiceDiscovery;

import dagger.Component;
import io.vertx.core.AsyncResult;
import io.vertx.core.Vertx;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves a service once from the command line and prints one line per target. */
class KubeDiscovery {

    static final int EXIT_OK = 0;
    static final int EXIT_LOOKUP_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final String ABSENT = "-";

    private static final Logger logger = LoggerFactory.getLogger(KubeDiscovery.class);

    private final Client client;

    private KubeDiscovery(Client client) {
        this.client = client;
    }

    private void run(Lookup query) {
        client.serviceDiscovery()
                .lookup(query, client.resolveTimeout())
                .onComplete(
                        ar -> {
                            int status = report(query, ar);
                            client.vertx().close().onComplete(n -> System.exit(status));
                        });
    }

    private static int report(Lookup query, AsyncResult<Resolved> ar) {
        if (ar.failed()) {
            logger.error("Lookup of {} failed", query, ar.cause());
            return EXIT_LOOKUP_FAILED;
        }
        Resolved resolved = ar.result();
        logger.info(
                "Resolved {} to {} target(s)",
                resolved.getServiceName(),
                resolved.getAddresses().size());
        resolved.getAddresses().forEach(t -> System.out.println(format(t)));
        return EXIT_OK;
    }

    static String format(ResolvedTarget target) {
        return String.join(
                " ",
                target.getHost(),
                target.getPort().map(String::valueOf).orElse(ABSENT),
                target.getAddress().map(InetAddress::getHostAddress).orElse(ABSENT));
    }

    static Lookup parseArgs(String[] args) {
        if (args.length < 1 || args.length > 2 || StringUtils.isBlank(args[0])) {
            throw new IllegalArgumentException("Usage: KubeDiscovery <serviceName> [portName]");
        }
        Lookup query = Lookup.of(args[0]);
        if (args.length == 2 && StringUtils.isNotBlank(args[1])) {
            query = query.withPortName(args[1]);
        }
        return query;
    }

    public static void main(String[] args) throws IOException {
        try (InputStream config = KubeDiscovery.class.getResourceAsStream("logging.properties")) {
            LogManager.getLogManager()
                    .updateConfiguration(config, k -> ((o, n) -> n != null ? n : o));
        }

        final Lookup query;
        try {
            query = parseArgs(args);
        } catch (IllegalArgumentException iae) {
            System.err.println(iae.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        final Client client = DaggerKubeDiscovery_Client.builder().build();
        new KubeDiscovery(client).run(query);
    }

    @Singleton
    @Component(modules = {MainModule.class})
    interface Client {
        ServiceDiscovery serviceDiscovery();

        Vertx vertx();

        @Named(Variables.RESOLVE_TIMEOUT_MS)
        Duration resolveTimeout();

        @Component.Builder
        interface Builder {
            Client build();
        }
    }
}
