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

import javax.inject.Singleton;

import io.kubediscovery.configuration.ConfigurationModule;
import io.kubediscovery.net.NetworkModule;
import io.kubediscovery.platform.PlatformModule;
import io.kubediscovery.sys.SystemModule;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import dagger.Module;
import dagger.Provides;

@Module(
        includes = {
            ConfigurationModule.class,
            NetworkModule.class,
            PlatformModule.class,
            SystemModule.class,
        })
public abstract class MainModule {

    // public since this is useful to use directly in tests
    @Provides
    @Singleton
    public static Gson provideGson() {
        return new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    }
}
