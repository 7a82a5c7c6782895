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

import java.nio.file.Path;

import javax.inject.Named;
import javax.inject.Singleton;

import io.kubediscovery.configuration.DiscoverySettings;
import io.kubediscovery.sys.FileSystem;

import dagger.Module;
import dagger.Provides;
import io.vertx.core.Vertx;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Module
public abstract class NetworkModule {

    public static final String KUBE_API_WEBCLIENT = "KUBE_API_WEBCLIENT";

    private static final Logger logger = LoggerFactory.getLogger(NetworkModule.class);

    @Provides
    @Singleton
    static Vertx provideVertx() {
        return Vertx.vertx();
    }

    @Provides
    @Singleton
    static NetworkResolver provideNetworkResolver() {
        return new NetworkResolver();
    }

    @Provides
    @Singleton
    @Named(KUBE_API_WEBCLIENT)
    static WebClient provideKubeApiWebClient(
            Vertx vertx, DiscoverySettings settings, FileSystem fs) {
        return WebClient.create(vertx, kubeApiClientOptions(settings, fs));
    }

    /**
     * TLS client options for talking to the API server. The CA certificate is read once, here, so
     * the resulting client is safe to share between concurrent lookups.
     */
    static WebClientOptions kubeApiClientOptions(DiscoverySettings settings, FileSystem fs) {
        WebClientOptions opts =
                new WebClientOptions()
                        .setSsl(true)
                        .setVerifyHost(true)
                        .setFollowRedirects(false)
                        .setTryUseCompression(true);
        Path caPath = fs.pathOf(settings.getApiCaPath());
        if (fs.isReadable(caPath)) {
            logger.info("Trusting API server CA certificate {}", caPath);
            opts.setTrustOptions(new PemTrustOptions().addCertPath(caPath.toString()));
        } else {
            logger.warn(
                    "API server CA certificate {} is not readable, falling back to the default"
                            + " trust store",
                    caPath);
        }
        return opts;
    }
}
