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
package io.kubediscovery.configuration;

import java.time.Duration;

import javax.inject.Named;
import javax.inject.Singleton;

import io.kubediscovery.sys.Environment;

import dagger.Module;
import dagger.Provides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Module
public abstract class ConfigurationModule {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationModule.class);

    @Provides
    @Singleton
    static DiscoverySettings provideDiscoverySettings(Environment env) {
        DiscoverySettings settings = new DiscoverySettings(env);
        logger.info(
                "Pod label selector template \"{}\", port name \"{}\", domain \"{}\"",
                settings.getPodLabelSelectorTemplate(),
                settings.getPodPortName(),
                settings.getPodDomain());
        return settings;
    }

    @Provides
    @Named(Variables.RESOLVE_TIMEOUT_MS)
    static Duration provideResolveTimeout(Environment env) {
        return Duration.ofMillis(
                Math.max(1, Long.parseLong(env.getEnv(Variables.RESOLVE_TIMEOUT_MS, "5000"))));
    }
}
