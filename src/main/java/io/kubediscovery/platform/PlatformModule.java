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

import javax.inject.Named;
import javax.inject.Singleton;

import io.kubediscovery.platform.internal.KubeApiModule;

import dagger.Module;
import dagger.Provides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Module(includes = {KubeApiModule.class})
public abstract class PlatformModule {

    private static final Logger logger = LoggerFactory.getLogger(PlatformModule.class);

    @Provides
    @Singleton
    static ServiceDiscovery provideServiceDiscovery(
            @Named(KubeApiModule.KUBE_API_DISCOVERY) ServiceDiscovery kubeApi) {
        logger.info("Selected ServiceDiscovery \"{}\"", kubeApi.getClass().getSimpleName());
        return kubeApi;
    }
}
