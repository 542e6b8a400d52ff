/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.imagecache.server.connector.kubernetes;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.imagecache.common.runtime.ImageCacheRuntime;
import com.netflix.imagecache.server.MetricConstants;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DefaultKubeClusterConnector implements KubeClusterConnector {

    private static final Logger logger = LoggerFactory.getLogger(DefaultKubeClusterConnector.class);

    private static final String METRIC_ROOT = MetricConstants.METRIC_KUBERNETES + "api";

    private final KubernetesClient client;
    private final String namespace;
    private final Registry registry;
    private final Id requestId;

    @Inject
    public DefaultKubeClusterConnector(KubernetesClient client,
                                       KubeConnectorConfiguration configuration,
                                       ImageCacheRuntime runtime) {
        this.client = client;
        this.namespace = configuration.getNamespace();
        this.registry = runtime.getRegistry();
        this.requestId = registry.createId(METRIC_ROOT);
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public List<Node> getNodes() {
        return call("listNodes", () -> client.nodes().list().getItems());
    }

    @Override
    public DaemonSet createDaemonSet(DaemonSet daemonSet) {
        return call("createDaemonSet", () -> client.apps().daemonSets().inNamespace(namespace).resource(daemonSet).create());
    }

    @Override
    public Optional<DaemonSet> findDaemonSet(String name) {
        return Optional.ofNullable(call("getDaemonSet", () -> client.apps().daemonSets().inNamespace(namespace).withName(name).get()));
    }

    @Override
    public boolean deleteDaemonSet(String name) {
        List<StatusDetails> details = call("deleteDaemonSet",
                () -> client.apps().daemonSets().inNamespace(namespace).withName(name).delete()
        );
        boolean deleted = details != null && !details.isEmpty();
        logger.debug("Delete of DaemonSet {}/{}: deleted={}", namespace, name, deleted);
        return deleted;
    }

    @Override
    public List<DaemonSet> findDaemonSets(Map<String, String> labels) {
        return call("listDaemonSets", () -> client.apps().daemonSets().inNamespace(namespace).withLabels(labels).list().getItems());
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            T result = action.get();
            registry.counter(requestId.withTag("operation", operation).withTag("status", "success")).increment();
            return result;
        } catch (KubernetesClientException e) {
            registry.counter(requestId.withTag("operation", operation).withTag("status", "error")).increment();
            throw new KubeApiException(operation, e);
        }
    }
}
