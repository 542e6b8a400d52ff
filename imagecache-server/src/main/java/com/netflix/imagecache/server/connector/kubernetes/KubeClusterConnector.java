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

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;

/**
 * The subset of the Kubernetes API used by the image cache. All DaemonSet operations are scoped to the
 * configured namespace. Failures are reported as {@link KubeApiException}.
 */
public interface KubeClusterConnector {

    String getNamespace();

    List<Node> getNodes();

    DaemonSet createDaemonSet(DaemonSet daemonSet);

    Optional<DaemonSet> findDaemonSet(String name);

    /**
     * @return false if the DaemonSet did not exist
     */
    boolean deleteDaemonSet(String name);

    List<DaemonSet> findDaemonSets(Map<String, String> labels);
}
