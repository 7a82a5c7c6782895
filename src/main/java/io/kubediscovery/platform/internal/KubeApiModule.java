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

import javax.inject.Named;
import javax.inject.Singleton;

import io.kubediscovery.configuration.DiscoverySettings;
import io.kubediscovery.net.NetworkModule;
import io.kubediscovery.net.NetworkResolver;
import io.kubediscovery.platform.ServiceDiscovery;
import io.kubediscovery.sys.Environment;
import io.kubediscovery.sys.FileSystem;

import com.google.gson.Gson;
import dagger.Module;
import dagger.Provides;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;

@Module
public abstract class KubeApiModule {

    public static final String KUBE_API_DISCOVERY = "KUBE_API_DISCOVERY";

    @Provides
    @Singleton
    static ServiceAccountCredentials provideServiceAccountCredentials(
            DiscoverySettings settings, FileSystem fs) {
        return new ServiceAccountCredentials(settings, fs);
    }

    @Provides
    @Singleton
    static KubeApiRequestFactory provideKubeApiRequestFactory(
            Environment env, DiscoverySettings settings) {
        return new KubeApiRequestFactory(env, settings);
    }

    @Provides
    @Singleton
    static PodListParser providePodListParser(Gson gson) {
        return new PodListParser(gson);
    }

    @Provides
    @Singleton
    static PodTargetResolver providePodTargetResolver(NetworkResolver resolver) {
        return new PodTargetResolver(resolver);
    }

    @Provides
    @Singleton
    @Named(KUBE_API_DISCOVERY)
    static ServiceDiscovery provideKubeApiServiceDiscovery(
            Vertx vertx,
            @Named(NetworkModule.KUBE_API_WEBCLIENT) WebClient webClient,
            DiscoverySettings settings,
            ServiceAccountCredentials credentials,
            KubeApiRequestFactory requestFactory,
            PodListParser parser,
            PodTargetResolver targetResolver) {
        return new KubeApiServiceDiscovery(
                vertx, webClient, settings, credentials, requestFactory, parser, targetResolver);
    }
}
