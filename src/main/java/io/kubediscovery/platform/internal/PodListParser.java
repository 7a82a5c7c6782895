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

import java.util.List;
import java.util.Objects;

import io.kubediscovery.platform.UnmarshalException;
import io.kubediscovery.platform.internal.PodList.Container;
import io.kubediscovery.platform.internal.PodList.ContainerPort;
import io.kubediscovery.platform.internal.PodList.Pod;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;

class PodListParser {

    static final String ITEMS = "items";

    private final Gson gson;

    PodListParser(Gson gson) {
        this.gson = gson;
    }

    /**
     * Binds a Kubernetes API response body to a {@link PodList}. The document must be an object
     * with an {@code items} array; everything below that is optional.
     *
     * @throws UnmarshalException if the body is not JSON or does not have the pod list shape
     */
    PodList parse(String body) throws UnmarshalException {
        try {
            JsonElement json = JsonParser.parseString(Objects.requireNonNullElse(body, ""));
            if (!json.isJsonObject()) {
                throw new JsonParseException(
                        String.format("Expected a JSON object but found %s", describe(json)));
            }
            JsonElement items = json.getAsJsonObject().get(ITEMS);
            if (items == null || !items.isJsonArray()) {
                throw new JsonParseException(
                        String.format("Expected \"%s\" to be an array", ITEMS));
            }
            PodList podList = gson.fromJson(json, PodList.class);
            validate(podList);
            return podList;
        } catch (JsonParseException | IllegalStateException e) {
            throw new UnmarshalException(body, e);
        }
    }

    /** Response body for diagnostics. Never fails; a missing body is the empty string. */
    String bodyAsText(HttpResponse<Buffer> response) {
        return Objects.requireNonNullElse(response.bodyAsString(), "");
    }

    private void validate(PodList podList) {
        for (Pod pod : podList.items()) {
            if (pod == null || pod.spec() == null || pod.spec().containers() == null) {
                continue;
            }
            for (Container container : pod.spec().containers()) {
                List<ContainerPort> ports = container == null ? null : container.ports();
                if (ports == null) {
                    continue;
                }
                for (ContainerPort port : ports) {
                    if (port != null && port.containerPort() == null) {
                        throw new JsonParseException(
                                String.format(
                                        "Port \"%s\" of container \"%s\" has no containerPort",
                                        port.name(), container.name()));
                    }
                }
            }
        }
    }

    private static String describe(JsonElement json) {
        if (json.isJsonNull()) {
            return "null";
        }
        if (json.isJsonArray()) {
            return "an array";
        }
        return "a primitive";
    }
}
