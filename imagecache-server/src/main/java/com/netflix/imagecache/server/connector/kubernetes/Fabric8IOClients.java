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

import java.util.Optional;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

public final class Fabric8IOClients {

    private Fabric8IOClients() {
    }

    /**
     * Creates a client configured from the environment (in-cluster service account or kube config file).
     */
    public static KubernetesClient createFabric8IOClient() {
        return new KubernetesClientBuilder().build();
    }

    public static Optional<Throwable> checkKubeConnectivity(KubernetesClient fabric8IOClient) {
        try {
            fabric8IOClient.getKubernetesVersion();
        } catch (Throwable e) {
            return Optional.of(e);
        }
        return Optional.empty();
    }

    public static KubernetesClient mustHaveKubeConnectivity(KubernetesClient fabric8IOClient) {
        checkKubeConnectivity(fabric8IOClient).ifPresent(error -> {
            throw new IllegalStateException("Kube client connectivity error", error);
        });
        return fabric8IOClient;
    }
}
