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

import java.time.Duration;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import io.kubediscovery.configuration.DiscoverySettings;
import io.kubediscovery.platform.ConfigurationMissingException;
import io.kubediscovery.platform.ForbiddenException;
import io.kubediscovery.platform.KubeApiException;
import io.kubediscovery.platform.Lookup;
import io.kubediscovery.platform.LookupTimeoutException;
import io.kubediscovery.platform.NetworkFailureException;
import io.kubediscovery.platform.NonSuccessStatusException;
import io.kubediscovery.platform.Resolved;
import io.kubediscovery.platform.ResolvedTarget;
import io.kubediscovery.platform.ServiceDiscovery;
import io.kubediscovery.platform.UnmarshalException;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves services by listing the pods that match a label selector through the Kubernetes API.
 * Each lookup is a single request; nothing is cached or retried.
 */
class KubeApiServiceDiscovery implements ServiceDiscovery {

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final Vertx vertx;
    private final WebClient webClient;
    private final DiscoverySettings settings;
    private final ServiceAccountCredentials credentials;
    private final KubeApiRequestFactory requestFactory;
    private final PodListParser parser;
    private final PodTargetResolver targetResolver;

    KubeApiServiceDiscovery(
            Vertx vertx,
            WebClient webClient,
            DiscoverySettings settings,
            ServiceAccountCredentials credentials,
            KubeApiRequestFactory requestFactory,
            PodListParser parser,
            PodTargetResolver targetResolver) {
        this.vertx = vertx;
        this.webClient = webClient;
        this.settings = settings;
        this.credentials = credentials;
        this.requestFactory = requestFactory;
        this.parser = parser;
        this.targetResolver = targetResolver;
    }

    @Override
    public Future<Resolved> lookup(Lookup query, Duration resolveTimeout) {
        String labelSelector;
        try {
            labelSelector = settings.podLabelSelector(query.getServiceName());
        } catch (IllegalFormatException ife) {
            return Future.failedFuture(
                    new ConfigurationMissingException(
                            String.format("Invalid pod label selector: %s", ife.getMessage())));
        }
        String portName = query.getPortName().orElseGet(settings::getPodPortName);
        String podNamespace = credentials.getPodNamespace();
        logger.info(
                "Querying for pods with label selector: [{}]. Namespace: [{}]. Port: [{}] (from"
                        + " lookup? {})",
                labelSelector,
                podNamespace,
                portName,
                query.getPortName().isPresent());

        Optional<PodListRequest> request =
                requestFactory.create(credentials.getApiToken(), podNamespace, labelSelector);
        if (request.isEmpty()) {
            return Future.failedFuture(
                    new ConfigurationMissingException(
                            requestFactory.missingConfigurationMessage()));
        }

        return send(request.get(), resolveTimeout)
                .compose(this::readPodList)
                .map(podList -> resolve(query.getServiceName(), podList, portName, podNamespace));
    }

    private Future<HttpResponse<Buffer>> send(PodListRequest request, Duration resolveTimeout) {
        long timeoutMs = Math.max(1, resolveTimeout.toMillis());
        Promise<HttpResponse<Buffer>> promise = Promise.promise();
        // bounds the whole round trip, including body buffering
        long timerId =
                vertx.setTimer(
                        timeoutMs,
                        id -> {
                            if (promise.tryFail(new LookupTimeoutException(resolveTimeout))) {
                                logger.warn("{} did not complete within {} ms", request, timeoutMs);
                            }
                        });
        logger.debug("{}", request);
        webClient
                .get(request.port(), request.host(), request.path())
                .addQueryParam(PodListRequest.LABEL_SELECTOR_PARAM, request.labelSelector())
                .putHeader(HttpHeaders.AUTHORIZATION.toString(), request.authorizationHeader())
                .timeout(timeoutMs)
                .send()
                .onComplete(
                        ar -> {
                            vertx.cancelTimer(timerId);
                            if (ar.succeeded()) {
                                promise.tryComplete(ar.result());
                            } else {
                                promise.tryFail(classifyFailure(ar.cause(), resolveTimeout));
                            }
                        });
        return promise.future();
    }

    private Future<PodList> readPodList(HttpResponse<Buffer> response) {
        int statusCode = response.statusCode();
        String body = parser.bodyAsText(response);
        switch (statusCode) {
            case 200:
                logger.debug("Kubernetes API entity: [{}]", body);
                try {
                    return Future.succeededFuture(parser.parse(body));
                } catch (UnmarshalException e) {
                    logger.warn(
                            "Failed to unmarshal Kubernetes API response.  Status code: [{}];"
                                    + " Response body: [{}]. Ex: [{}]",
                            statusCode,
                            body,
                            e.getCause().getMessage());
                    return Future.failedFuture(e);
                }
            case 403:
                logger.warn(
                        "Forbidden to communicate with Kubernetes API server; check RBAC"
                                + " settings. Response: [{}]",
                        body);
                return Future.failedFuture(new ForbiddenException());
            default:
                logger.warn(
                        "Non-200 when communicating with Kubernetes API server. Status code:"
                                + " [{}]. Response body: [{}]",
                        statusCode,
                        body);
                return Future.failedFuture(new NonSuccessStatusException(statusCode));
        }
    }

    private Resolved resolve(
            String serviceName, PodList podList, String portName, String podNamespace) {
        List<ResolvedTarget> addresses =
                targetResolver.targets(podList, portName, podNamespace, settings.getPodDomain());
        if (addresses.isEmpty() && !podList.items().isEmpty() && logger.isWarnEnabled()) {
            logger.warn(
                    "No targets found from pod list. Is the correct port name configured?"
                            + " Current configuration: [{}]. Ports on pods: [{}]",
                    portName,
                    targetResolver.portNames(podList));
        }
        return new Resolved(serviceName, addresses);
    }

    private KubeApiException classifyFailure(Throwable t, Duration resolveTimeout) {
        if (t instanceof KubeApiException) {
            return (KubeApiException) t;
        }
        if (t instanceof TimeoutException) {
            return new LookupTimeoutException(resolveTimeout, t);
        }
        logger.warn("Kubernetes API request failed", t);
        return new NetworkFailureException(t);
    }
}
