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

package com.netflix.imagecache.server.pull;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.google.common.hash.Hashing;
import com.netflix.imagecache.api.policy.model.LabelSelector;
import com.netflix.imagecache.common.util.StringExt;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.DaemonSetBuilder;

/**
 * Builds the DaemonSet that forces an image onto all nodes matching a label selector. The container only
 * sleeps; the pull happens as a side effect of the kubelet starting it with the 'Always' pull policy.
 */
public class PullWorkloadFactory {

    public static final String LABEL_IMAGECACHE = "imagecache";
    public static final String LABEL_IMAGECACHE_PULL_VALUE = "pull";
    public static final String LABEL_APP = "app";
    public static final String LABEL_POLICY = "imagecache.policy";

    public static final String CONTAINER_NAME = "imagecache";

    private static final String NAME_PREFIX = "imagecache-";
    private static final int MAX_NAME_LENGTH = 63;
    private static final int HASH_LENGTH = 10;

    private final PullOrchestratorConfiguration configuration;

    public PullWorkloadFactory(PullOrchestratorConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Returns a DNS-1123 label unique for the (policy, image, attempt) triple:
     * <code>imagecache-&lt;policy&gt;-&lt;image hash&gt;-&lt;attempt&gt;</code>.
     */
    public static String buildWorkloadName(String policyName, String imageReference, int attempt) {
        String hash = Hashing.sha256().hashString(imageReference, StandardCharsets.UTF_8).toString().substring(0, HASH_LENGTH);
        String suffix = "-" + hash + "-" + attempt;
        int maxPolicyLength = MAX_NAME_LENGTH - NAME_PREFIX.length() - suffix.length();

        String policyPart = policyName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        if (policyPart.length() > maxPolicyLength) {
            policyPart = policyPart.substring(0, maxPolicyLength);
        }
        policyPart = policyPart.replaceAll("^-+|-+$", "");
        return NAME_PREFIX + (policyPart.isEmpty() ? "policy" : policyPart) + suffix;
    }

    public static Map<String, String> buildSelectorLabels(String workloadName) {
        Map<String, String> labels = new HashMap<>();
        labels.put(LABEL_IMAGECACHE, LABEL_IMAGECACHE_PULL_VALUE);
        labels.put(LABEL_APP, workloadName);
        return labels;
    }

    public DaemonSet newPullDaemonSet(String workloadName, String policyName, String imageReference, LabelSelector labelSelector) {
        Map<String, String> labels = buildSelectorLabels(workloadName);
        labels.put(LABEL_POLICY, policyName);

        String command = "sleep " + configuration.getSleepSeconds();

        DaemonSetBuilder builder = new DaemonSetBuilder()
                .withNewMetadata()
                .withName(workloadName)
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withNewSelector()
                .withMatchLabels(buildSelectorLabels(workloadName))
                .endSelector()
                .withNewTemplate()
                .withNewMetadata()
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withNodeSelector(new HashMap<>(labelSelector.getLabels()))
                .withAutomountServiceAccountToken(false)
                .withTerminationGracePeriodSeconds(1L)
                .withNewSecurityContext()
                .withRunAsNonRoot(true)
                .withRunAsUser(configuration.getRunAsUser())
                .withRunAsGroup(configuration.getRunAsGroup())
                .endSecurityContext()
                .addNewContainer()
                .withName(CONTAINER_NAME)
                .withImage(imageReference)
                .withImagePullPolicy("Always")
                .withCommand("/bin/sh", "-c", command)
                .withNewSecurityContext()
                .withAllowPrivilegeEscalation(false)
                .withReadOnlyRootFilesystem(true)
                .withNewCapabilities()
                .withDrop("ALL")
                .endCapabilities()
                .endSecurityContext()
                .endContainer()
                .endSpec()
                .endTemplate()
                .endSpec();

        DaemonSet daemonSet = builder.build();
        String pullSecretName = configuration.getPullSecretName();
        if (StringExt.isNotEmpty(pullSecretName)) {
            daemonSet.getSpec().getTemplate().getSpec().setImagePullSecrets(Collections.singletonList(new LocalObjectReference(pullSecretName)));
        }
        return daemonSet;
    }
}
